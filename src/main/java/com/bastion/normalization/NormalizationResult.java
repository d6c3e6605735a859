package com.bastion.normalization;

import com.bastion.domain.WafEvent;

import java.util.Optional;

/**
 * Outcome of normalizing one raw record: either a canonical event, or a skip.
 *
 * A skip carries no reason. Records without a correlation id or a usable
 * timestamp are expected in real exports and are not errors.
 */
public final class NormalizationResult {

    private static final NormalizationResult SKIPPED = new NormalizationResult(null);

    private final WafEvent event;

    private NormalizationResult(WafEvent event) {
        this.event = event;
    }

    public static NormalizationResult normalized(WafEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event must not be null");
        }
        return new NormalizationResult(event);
    }

    public static NormalizationResult skipped() {
        return SKIPPED;
    }

    public boolean isNormalized() {
        return event != null;
    }

    public boolean isSkipped() {
        return event == null;
    }

    /**
     * @return the event
     * @throws IllegalStateException if the record was skipped
     */
    public WafEvent getEvent() {
        if (event == null) {
            throw new IllegalStateException("Record was skipped");
        }
        return event;
    }

    public Optional<WafEvent> toOptional() {
        return Optional.ofNullable(event);
    }

    @Override
    public String toString() {
        return event != null ? "Normalized{" + event + "}" : "Skipped";
    }
}
