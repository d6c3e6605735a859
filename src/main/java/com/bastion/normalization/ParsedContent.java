package com.bastion.normalization;

import com.bastion.domain.WafEvent;

import java.util.Collections;
import java.util.List;

/**
 * Events and per-record errors extracted from one file
 */
public class ParsedContent {

    /**
     * Layout detected for the file
     */
    public enum Format {
        JSON_ARRAY,
        NDJSON
    }

    private final Format format;
    private final List<WafEvent> events;
    private final List<String> errors;
    private final int skipped;

    public ParsedContent(Format format, List<WafEvent> events, List<String> errors, int skipped) {
        this.format = format;
        this.events = Collections.unmodifiableList(events);
        this.errors = Collections.unmodifiableList(errors);
        this.skipped = skipped;
    }

    public Format getFormat() {
        return format;
    }

    public List<WafEvent> getEvents() {
        return events;
    }

    public List<String> getErrors() {
        return errors;
    }

    /**
     * Records that decoded fine but had no usable ray id or timestamp
     */
    public int getSkipped() {
        return skipped;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
