/**
 * Shared helpers for error reporting and identifier handling.
 */
package io.github.yok.flexload.util;
