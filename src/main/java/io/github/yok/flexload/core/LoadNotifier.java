package io.github.yok.flexload.core;

/**
 * Sink for the terminal outcome of a run.
 */
public interface LoadNotifier {

    /**
     * Reports a successful run.
     *
     * @param summary run summary
     */
    void notifySuccess(RunSummary summary);

    /**
     * Reports a failed run.
     *
     * @param inputFile source file (base name)
     * @param tableName destination table
     * @param cause failure
     */
    void notifyFailure(String inputFile, String tableName, Throwable cause);
}
