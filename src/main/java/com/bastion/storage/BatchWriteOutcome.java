package com.bastion.storage;

/**
 * Result of writing all chunks of one file.
 *
 * When a chunk fails, the chunks committed before it stay in place: the tally
 * covers exactly those, and the failure is kept for reporting.
 */
public class BatchWriteOutcome {

    private final BatchTally tally;
    private final int total;
    private final RuntimeException failure;

    private BatchWriteOutcome(BatchTally tally, int total, RuntimeException failure) {
        this.tally = tally;
        this.total = total;
        this.failure = failure;
    }

    public static BatchWriteOutcome completed(BatchTally tally, int total) {
        return new BatchWriteOutcome(tally, total, null);
    }

    public static BatchWriteOutcome failed(BatchTally tally, int total, RuntimeException failure) {
        return new BatchWriteOutcome(tally, total, failure);
    }

    public BatchTally getTally() {
        return tally;
    }

    public long getInserted() {
        return tally.getInserted();
    }

    public long getDeduped() {
        return tally.getDeduped();
    }

    /**
     * Number of events handed to the writer
     */
    public int getTotal() {
        return total;
    }

    /**
     * Events never attempted because an earlier chunk failed
     */
    public long getUnprocessed() {
        return total - tally.getProcessed();
    }

    public boolean isComplete() {
        return failure == null;
    }

    public RuntimeException getFailure() {
        return failure;
    }
}
