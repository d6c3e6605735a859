package com.bastion.storage;

import java.sql.Statement;

/**
 * Running inserted/deduped totals of a chunked write.
 *
 * Immutable: every chunk yields its own tally which is merged into the
 * accumulated one with {@link #plus(BatchTally)}.
 */
public final class BatchTally {

    private static final BatchTally EMPTY = new BatchTally(0, 0, 0);

    private final long inserted;
    private final long deduped;
    private final int chunks;

    public BatchTally(long inserted, long deduped, int chunks) {
        this.inserted = inserted;
        this.deduped = deduped;
        this.chunks = chunks;
    }

    public static BatchTally empty() {
        return EMPTY;
    }

    /**
     * Tally of a single chunk from its JDBC update counts.
     *
     * A count above zero is a written row. Zero is a row suppressed by the
     * uniqueness constraint. SUCCESS_NO_INFO is counted as written since the
     * driver reported no conflict.
     */
    public static BatchTally ofUpdateCounts(int[] updateCounts) {
        long inserted = 0;
        long deduped = 0;
        for (int count : updateCounts) {
            if (count > 0 || count == Statement.SUCCESS_NO_INFO) {
                inserted++;
            } else {
                deduped++;
            }
        }
        return new BatchTally(inserted, deduped, 1);
    }

    public BatchTally plus(BatchTally other) {
        return new BatchTally(inserted + other.inserted, deduped + other.deduped, chunks + other.chunks);
    }

    public long getInserted() {
        return inserted;
    }

    public long getDeduped() {
        return deduped;
    }

    /**
     * Rows processed so far, inserted or deduped
     */
    public long getProcessed() {
        return inserted + deduped;
    }

    public int getChunks() {
        return chunks;
    }

    @Override
    public String toString() {
        return "BatchTally{inserted=" + inserted + ", deduped=" + deduped + ", chunks=" + chunks + "}";
    }
}
