package io.github.yok.flexload.core;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link ProgressListener} that writes progress to the log.
 */
@Slf4j
public class LoggingProgressListener implements ProgressListener {

    private final String label;

    /**
     * Creates a listener.
     *
     * @param label prefix of every log line, normally the destination table
     */
    public LoggingProgressListener(String label) {
        this.label = label;
    }

    @Override
    public void phaseStarted(LoadPhase phase) {
        log.info("[{}] {} | started", label, phase);
    }

    @Override
    public void rowsRead(long rowsRead) {
        log.info("[{}] READ | {} rows read", label, rowsRead);
    }

    @Override
    public void batchInserted(int batchNumber, int batchCount, long insertedRows) {
        log.info("[{}] LOAD | batch {}/{} inserted, {} rows total", label, batchNumber,
                batchCount, insertedRows);
    }
}
