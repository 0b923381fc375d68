package io.github.yok.flexload.exception;

import lombok.Getter;

/**
 * Thrown when a bulk insert into the staging table fails. The batch is neither retried nor
 * partially recovered.
 */
@Getter
public class BatchInsertException extends TableLoadException {

    private static final long serialVersionUID = 1L;

    // Zero-based index of the failed batch
    private final int batchIndex;

    // Number of rows in the failed batch
    private final int batchRows;

    /**
     * Creates an exception for a failed batch.
     *
     * @param message detail message
     * @param batchIndex zero-based index of the failed batch
     * @param batchRows number of rows in the failed batch
     * @param cause root cause
     */
    public BatchInsertException(String message, int batchIndex, int batchRows, Throwable cause) {
        super(message, cause);
        this.batchIndex = batchIndex;
        this.batchRows = batchRows;
    }
}
