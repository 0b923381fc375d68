package io.github.yok.flexload.core;

import io.github.yok.flexload.util.ErrorHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link LoadNotifier} that writes the outcome to the log.
 */
@Slf4j
@Component
public class LoggingLoadNotifier implements LoadNotifier {

    @Override
    public void notifySuccess(RunSummary s) {
        log.info("[{}] Load completed | file={}{} total={} valid={} empty={} skipped={}"
                + " coercionWarnings={} duration={}s", s.getTableName(), s.getInputFile(),
                s.getSheetName() != null ? " sheet=" + s.getSheetName() : "", s.getTotalRows(),
                s.getValidRows(), s.getEmptyRows(), s.getSkippedRows(), s.getCoercionWarnings(),
                s.getDurationSeconds());
        if (!s.getMissingColumns().isEmpty()) {
            log.warn("[{}] Columns missing from the source: {}", s.getTableName(),
                    s.getMissingColumns());
        }
    }

    @Override
    public void notifyFailure(String inputFile, String tableName, Throwable cause) {
        log.error("[{}] Load failed | file={} error={}", tableName, inputFile,
                ErrorHandler.describe(cause));
    }
}
