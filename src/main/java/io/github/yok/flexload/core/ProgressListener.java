package io.github.yok.flexload.core;

/**
 * Receives progress of a run. Called synchronously on the loading thread; every method defaults
 * to doing nothing.
 */
public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() {};

    /**
     * Called when a phase begins.
     *
     * @param phase phase
     */
    default void phaseStarted(LoadPhase phase) {}

    /**
     * Called periodically while source rows are read.
     *
     * @param rowsRead data rows read so far
     */
    default void rowsRead(long rowsRead) {}

    /**
     * Called after each inserted batch.
     *
     * @param batchNumber one-based batch number
     * @param batchCount number of batches
     * @param insertedRows rows inserted so far
     */
    default void batchInserted(int batchNumber, int batchCount, long insertedRows) {}
}
