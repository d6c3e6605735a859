package com.bastion.ingestion;

import com.bastion.domain.TimeRange;
import com.bastion.normalization.ParsedContent;
import com.bastion.storage.BatchTally;
import com.bastion.storage.BatchWriteOutcome;

/**
 * Parse and write results of ingesting one file's content
 */
public class FileIngestion {

    private final ParsedContent parsed;
    private final BatchWriteOutcome writeOutcome;

    FileIngestion(ParsedContent parsed, BatchWriteOutcome writeOutcome) {
        this.parsed = parsed;
        this.writeOutcome = writeOutcome;
    }

    public ParsedContent getParsed() {
        return parsed;
    }

    /**
     * Write outcome, null when the content held no valid events
     */
    public BatchWriteOutcome getWriteOutcome() {
        return writeOutcome;
    }

    public boolean hasEvents() {
        return !parsed.isEmpty();
    }

    public boolean isWriteComplete() {
        return writeOutcome == null || writeOutcome.isComplete();
    }

    public int getTotal() {
        return parsed.getEvents().size();
    }

    public BatchTally getTally() {
        return writeOutcome != null ? writeOutcome.getTally() : BatchTally.empty();
    }

    public TimeRange getTimeRange() {
        return TimeRange.of(parsed.getEvents());
    }
}
