package com.openrangelabs.ingestor.exception;

import com.openrangelabs.ingestor.connector.CancellationSignal;

/**
 * Raised inside a pipeline when its cancellation signal fires. Connectors convert it
 * into a cancelled or timed-out result before it reaches the caller.
 */
public class OperationCancelledException extends IngestionException {

    private final CancellationSignal.Reason reason;
    private final long processedCount;

    public OperationCancelledException(CancellationSignal.Reason reason, long processedCount) {
        super(reason == CancellationSignal.Reason.TIMEOUT
                ? "Operation timed out after " + processedCount + " records"
                : "Operation cancelled after " + processedCount + " records");
        this.reason = reason;
        this.processedCount = processedCount;
    }

    public CancellationSignal.Reason getReason() {
        return reason;
    }

    public long getProcessedCount() {
        return processedCount;
    }
}
