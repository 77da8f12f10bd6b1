package com.example.chatrelay.stream;

import java.util.List;

/**
 * Raised when a stage failed on a record. Records before {@link #getFailedIndex()}
 * have been fully processed; the failed record and everything after it must be
 * redelivered.
 */
public class StreamDispatchException extends RuntimeException {

    private final String stage;
    private final int failedIndex;
    private final DispatchReport report;

    public StreamDispatchException(String stage, int failedIndex, DispatchReport report, Throwable cause) {
        super("Stage '" + stage + "' failed on record " + failedIndex + ": " + cause.getMessage(), cause);
        this.stage = stage;
        this.failedIndex = failedIndex;
        this.report = report;
    }

    public String getStage() {
        return stage;
    }

    public int getFailedIndex() {
        return failedIndex;
    }

    public DispatchReport getReport() {
        return report;
    }

    public List<StreamRecord> remaining(List<StreamRecord> batch) {
        return batch.subList(failedIndex, batch.size());
    }
}
