package io.github.yok.flexload.core;

/**
 * Phases of a run, in execution order.
 */
public enum LoadPhase {
    READ, STAGE, LOAD, PROMOTE
}
