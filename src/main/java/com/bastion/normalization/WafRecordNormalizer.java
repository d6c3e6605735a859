package com.bastion.normalization;

import com.bastion.domain.RuleType;
import com.bastion.domain.WafAction;
import com.bastion.domain.WafEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Maps one raw WAF export record onto the canonical {@link WafEvent}.
 *
 * Export formats differ between vendor API versions and tools (PascalCase log
 * push fields, camelCase GraphQL fields, snake_case CSV conversions), so every
 * canonical field is resolved from its own ordered list of known spellings.
 * Only the ray id and the timestamp are mandatory; a record lacking either is
 * skipped. Every other field degrades to absent instead of failing the record.
 *
 * Multi-match records (several rule ids, actions or sources) are collapsed to
 * their primary match: only the first element of the first present list
 * variant is kept.
 *
 * Stateless and free of I/O.
 */
@Component
public class WafRecordNormalizer {

    private static final Logger log = LoggerFactory.getLogger(WafRecordNormalizer.class);

    /**
     * Epoch values below this are seconds
     */
    static final long SECONDS_THRESHOLD = 10_000_000_000L;

    /**
     * Epoch values below this (and at or above the seconds threshold) are milliseconds
     */
    static final long MILLIS_THRESHOLD = 100_000_000_000_000L;

    /**
     * Epoch values below this are microseconds, at or above are nanoseconds
     */
    static final long MICROS_THRESHOLD = 100_000_000_000_000_000L;

    /**
     * 9999-12-31T23:59:59.999Z, the last instant SQLite date functions accept
     */
    static final long MAX_EVENT_MILLIS = 253_402_300_799_999L;

    /**
     * Space-separated date and time ("2024-01-15 10:30:00"), optionally followed by an offset
     */
    private static final DateTimeFormatter SPACED_DATE_TIME = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .appendLiteral(' ')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart()
        .appendOffsetId()
        .optionalEnd()
        .toFormatter();

    private static final List<Function<String, Instant>> ISO_FORMATS = List.of(
        text -> OffsetDateTime.parse(text).toInstant(),
        Instant::parse,
        text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
        text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant(),
        WafRecordNormalizer::parseSpaced
    );

    static final String[] RAY_ID = {"RayID", "rayId", "ray_id", "rayName", "ray_name"};
    static final String[] TIMESTAMP = {"EdgeStartTimestamp", "edgeStartTimestamp", "timestamp", "event_timestamp", "datetime"};
    static final String[] SRC_IP = {"ClientIP", "clientIP", "client_ip", "source_ip"};
    static final String[] SRC_COUNTRY = {"ClientCountry", "clientCountry", "client_country", "clientCountryName", "client_country_name"};
    static final String[] SRC_ASN = {"ClientASN", "clientASN", "client_asn", "clientAsn"};
    static final String[] COLO = {"EdgeColoCode", "edgeColoCode", "colo", "datacenter", "edgeColo", "edge_colo"};
    static final String[] HOST = {"ClientRequestHost", "clientRequestHost", "host", "hostname", "clientRequestHTTPHost", "client_request_http_host"};
    static final String[] PATH = {"ClientRequestPath", "clientRequestPath", "path", "uri", "client_request_path"};
    static final String[] METHOD = {"ClientRequestMethod", "clientRequestMethod", "method", "clientRequestHTTPMethodName", "client_request_http_method_name"};
    static final String[] STATUS = {"EdgeResponseStatus", "edgeResponseStatus", "status", "edge_response_status"};
    static final String[] RULE_ID_LISTS = {"FirewallMatchesRuleIDs", "firewallMatchesRuleIDs"};
    static final String[] RULE_ID = {"rule_id", "ruleId", "WAFRuleID", "wafRuleID"};
    static final String[] ACTION_LISTS = {"FirewallMatchesActions", "firewallMatchesActions"};
    static final String[] ACTION = {"action", "WAFAction", "wafAction"};
    static final String[] SERVICE_LISTS = {"FirewallMatchesSources", "firewallMatchesSources"};
    static final String[] SERVICE = {"service", "source"};
    static final String[] RULE_NAME = {"WAFRuleMessage", "wafRuleMessage", "rule_name", "description"};
    static final String[] MITIGATION_REASON = {"mitigation_reason", "mitigationReason", "MitigationReason"};
    static final String[] USER_AGENT = {"ClientRequestUserAgent", "clientRequestUserAgent", "user_agent", "ua", "userAgent"};
    static final String[] JA3 = {"JA3Hash", "ja3Hash", "ja3"};
    static final String[] BYTES = {"ClientRequestBytes", "clientRequestBytes", "bytes", "client_request_bytes"};
    static final String[] THREAT_SCORE = {"SecurityLevel", "securityLevel", "threat_score"};

    /**
     * Normalize a raw record.
     *
     * @param raw decoded JSON object, keys and values untrusted
     * @return the canonical event, or a skip when the ray id or timestamp is unusable
     */
    public NormalizationResult normalize(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return NormalizationResult.skipped();
        }

        RawRecord record = new RawRecord(raw);

        String rayId = record.text(RAY_ID);
        if (rayId == null) {
            return NormalizationResult.skipped();
        }

        Long eventTs = normalizeTimestamp(record.value(TIMESTAMP));
        if (eventTs == null) {
            log.debug("Skipping record {} with unusable timestamp", rayId);
            return NormalizationResult.skipped();
        }

        String ruleId = record.primaryMatch(RULE_ID_LISTS, RULE_ID);
        String service = record.primaryMatch(SERVICE_LISTS, SERVICE);
        String action = record.primaryMatch(ACTION_LISTS, ACTION);

        WafEvent event = WafEvent.builder()
            .rayId(rayId)
            .eventTs(eventTs)
            .srcIp(record.text(SRC_IP))
            .srcCountry(record.text(SRC_COUNTRY))
            .srcAsn(record.number(SRC_ASN))
            .colo(record.text(COLO))
            .host(record.text(HOST))
            .path(record.text(PATH))
            .method(record.text(METHOD))
            .status(toInteger(record.number(STATUS)))
            .ruleId(ruleId)
            .ruleName(record.text(RULE_NAME))
            .ruleType(RuleType.infer(ruleId, service))
            .action(WafAction.normalize(action))
            .service(service)
            .mitigationReason(record.text(MITIGATION_REASON))
            .userAgent(record.text(USER_AGENT))
            .ja3(record.text(JA3))
            .bytes(record.number(BYTES))
            .threatScore(record.number(THREAT_SCORE))
            .build();

        return NormalizationResult.normalized(event);
    }

    /**
     * Convert a vendor timestamp to epoch milliseconds.
     *
     * Accepts epoch numbers, numeric strings and ISO-8601 strings. The epoch
     * unit follows the magnitude: below 10^10 seconds, below 10^14
     * milliseconds, below 10^17 microseconds, nanoseconds above that. ISO
     * values without an offset are read as UTC.
     *
     * @param value raw timestamp value
     * @return epoch milliseconds, or null when absent, non-positive, unparseable
     *         or later than {@link #MAX_EVENT_MILLIS}
     */
    static Long normalizeTimestamp(Object value) {
        if (value instanceof Number) {
            double asDouble = ((Number) value).doubleValue();
            if (Double.isNaN(asDouble) || Double.isInfinite(asDouble)) {
                return null;
            }
            return fromEpoch(new BigDecimal(value.toString()));
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.isEmpty()) {
                return null;
            }
            if (RawRecord.isNumericText(text)) {
                return fromEpoch(new BigDecimal(text));
            }
            return parseIso(text);
        }
        return null;
    }

    private static Long fromEpoch(BigDecimal epoch) {
        if (epoch.signum() <= 0) {
            return null;
        }
        BigDecimal millis;
        if (epoch.compareTo(BigDecimal.valueOf(SECONDS_THRESHOLD)) < 0) {
            millis = epoch.movePointRight(3);
        } else if (epoch.compareTo(BigDecimal.valueOf(MILLIS_THRESHOLD)) < 0) {
            millis = epoch;
        } else if (epoch.compareTo(BigDecimal.valueOf(MICROS_THRESHOLD)) < 0) {
            millis = epoch.movePointLeft(3);
        } else {
            millis = epoch.movePointLeft(6);
        }
        if (millis.compareTo(BigDecimal.valueOf(MAX_EVENT_MILLIS)) > 0) {
            return null;
        }
        return withinRange(millis.longValue());
    }

    private static Long parseIso(String text) {
        for (Function<String, Instant> format : ISO_FORMATS) {
            try {
                return withinRange(format.apply(text).toEpochMilli());
            } catch (DateTimeParseException e) {
                log.trace("Timestamp '{}' does not match format: {}", text, e.getMessage());
            } catch (ArithmeticException e) {
                log.trace("Timestamp '{}' is out of range", text);
                return null;
            }
        }
        return null;
    }

    private static Instant parseSpaced(String text) {
        TemporalAccessor parsed = SPACED_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toInstant();
        }
        return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }

    private static Long withinRange(long millis) {
        return millis > 0 && millis <= MAX_EVENT_MILLIS ? millis : null;
    }

    private static Integer toInteger(Long value) {
        if (value == null || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            return null;
        }
        return value.intValue();
    }
}
