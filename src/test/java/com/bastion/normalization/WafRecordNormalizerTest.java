package com.bastion.normalization;

import com.bastion.domain.RuleType;
import com.bastion.domain.WafAction;
import com.bastion.domain.WafEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for WafRecordNormalizer.
 *
 * Covers alias resolution, timestamp heuristics, action and rule type
 * normalization, and numeric coercion.
 */
@DisplayName("WafRecordNormalizer Tests")
class WafRecordNormalizerTest {

    private WafRecordNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new WafRecordNormalizer();
    }

    private static Map<String, Object> record(Object... keyValues) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    private WafEvent normalized(Map<String, Object> raw) {
        NormalizationResult result = normalizer.normalize(raw);
        assertThat(result.isNormalized()).as("normalized: %s", raw).isTrue();
        return result.getEvent();
    }

    @Nested
    @DisplayName("Required fields")
    class RequiredFields {

        @Test
        @DisplayName("Should skip a record without any ray id alias")
        void shouldSkipWithoutRayId() {
            NormalizationResult result = normalizer.normalize(
                record("EdgeStartTimestamp", 1_700_000_000_000L, "ClientIP", "192.0.2.1"));

            assertThat(result.isSkipped()).isTrue();
            assertThat(result.toOptional()).isEmpty();
        }

        @Test
        @DisplayName("Should skip a record whose ray id is empty or not a string")
        void shouldSkipWithEmptyRayId() {
            assertThat(normalizer.normalize(record("RayID", "", "timestamp", 1_700_000_000L)).isSkipped()).isTrue();
            assertThat(normalizer.normalize(record("RayID", 42, "timestamp", 1_700_000_000L)).isSkipped()).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"not-a-date", "2024-13-45T99:00:00Z", "", "   "})
        @DisplayName("Should skip a record with an unparseable timestamp")
        void shouldSkipUnparseableTimestamp(String timestamp) {
            NormalizationResult result = normalizer.normalize(record("RayID", "abc", "timestamp", timestamp));

            assertThat(result.isSkipped()).isTrue();
        }

        @Test
        @DisplayName("Should skip a record without a timestamp")
        void shouldSkipMissingTimestamp() {
            assertThat(normalizer.normalize(record("RayID", "abc")).isSkipped()).isTrue();
        }

        @Test
        @DisplayName("Should skip empty and null records without throwing")
        void shouldSkipEmptyRecord() {
            assertThat(normalizer.normalize(new HashMap<>()).isSkipped()).isTrue();
            assertThat(normalizer.normalize(null).isSkipped()).isTrue();
        }

        @Test
        @DisplayName("Should refuse to read the event of a skipped result")
        void shouldThrowWhenReadingSkippedEvent() {
            assertThatThrownBy(() -> NormalizationResult.skipped().getEvent())
                .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Timestamps")
    class Timestamps {

        @Test
        @DisplayName("Should normalize seconds and the equivalent milliseconds to the same instant")
        void shouldTreatSecondsAndMillisEqually() {
            WafEvent seconds = normalized(record("RayID", "r1", "timestamp", 999_999_999L));
            WafEvent millis = normalized(record("RayID", "r1", "timestamp", 999_999_999_000L));

            assertThat(seconds.getEventTs()).isEqualTo(999_999_999_000L);
            assertThat(millis.getEventTs()).isEqualTo(seconds.getEventTs());
        }

        @Test
        @DisplayName("Should apply the seconds heuristic to numeric strings")
        void shouldParseNumericString() {
            assertThat(normalized(record("RayID", "r1", "timestamp", "1700000000")).getEventTs())
                .isEqualTo(1_700_000_000_000L);
            assertThat(normalized(record("RayID", "r1", "timestamp", "1700000000123")).getEventTs())
                .isEqualTo(1_700_000_000_123L);
        }

        @Test
        @DisplayName("Should keep the millisecond part of fractional seconds")
        void shouldParseFractionalSeconds() {
            assertThat(normalized(record("RayID", "r1", "timestamp", 1_700_000_000.5)).getEventTs())
                .isEqualTo(1_700_000_000_500L);
        }

        @Test
        @DisplayName("Should parse ISO-8601 with zone, with offset and without offset as UTC")
        void shouldParseIso() {
            long expected = 1_709_287_200_000L;

            assertThat(normalized(record("RayID", "r1", "datetime", "2024-03-01T10:00:00Z")).getEventTs())
                .isEqualTo(expected);
            assertThat(normalized(record("RayID", "r1", "datetime", "2024-03-01T11:00:00+01:00")).getEventTs())
                .isEqualTo(expected);
            assertThat(normalized(record("RayID", "r1", "datetime", "2024-03-01T10:00:00")).getEventTs())
                .isEqualTo(expected);
        }

        @Test
        @DisplayName("Should reject zero and negative epoch values")
        void shouldRejectNonPositiveEpoch() {
            assertThat(normalizer.normalize(record("RayID", "r1", "timestamp", 0)).isSkipped()).isTrue();
            assertThat(normalizer.normalize(record("RayID", "r1", "timestamp", -5)).isSkipped()).isTrue();
        }

        @Test
        @DisplayName("Should scale microsecond and nanosecond epochs down to milliseconds")
        void shouldScaleHighResolutionEpochs() {
            assertThat(normalized(record("RayID", "r1", "EdgeStartTimestamp", 1_700_000_000_123_456L)).getEventTs())
                .isEqualTo(1_700_000_000_123L);
            assertThat(normalized(record("RayID", "r1", "EdgeStartTimestamp", 1_700_000_000_123_456_789L)).getEventTs())
                .isEqualTo(1_700_000_000_123L);
            assertThat(normalized(record("RayID", "r1", "EdgeStartTimestamp", "1700000000000000000")).getEventTs())
                .isEqualTo(1_700_000_000_000L);
        }

        @Test
        @DisplayName("Should skip timestamps past the year 9999")
        void shouldSkipTimestampsOutOfRange() {
            assertThat(normalizer.normalize(record("RayID", "r1", "timestamp", 1e40)).isSkipped()).isTrue();
            assertThat(normalizer.normalize(record("RayID", "r1", "timestamp", "+12024-03-01T10:00:00Z")).isSkipped())
                .isTrue();
            assertThat(normalized(record("RayID", "r1", "timestamp", "9999-12-31T23:59:59Z")).getEventTs())
                .isEqualTo(253_402_300_799_000L);
        }

        @Test
        @DisplayName("Should parse space-separated date and time as UTC unless an offset is given")
        void shouldParseSpaceSeparatedDateTime() {
            assertThat(normalized(record("RayID", "r1", "datetime", "2024-03-01 10:00:00")).getEventTs())
                .isEqualTo(1_709_287_200_000L);
            assertThat(normalized(record("RayID", "r1", "datetime", "2024-03-01 10:00:00.250")).getEventTs())
                .isEqualTo(1_709_287_200_250L);
            assertThat(normalized(record("RayID", "r1", "datetime", "2024-03-01 11:00:00+01:00")).getEventTs())
                .isEqualTo(1_709_287_200_000L);
        }

        @Test
        @DisplayName("Should take the first present timestamp alias")
        void shouldUseTimestampAliasOrder() {
            WafEvent event = normalized(record(
                "RayID", "r1",
                "EdgeStartTimestamp", "2024-03-01T10:00:00Z",
                "timestamp", 1L));

            assertThat(event.getEventTs()).isEqualTo(1_709_287_200_000L);
        }
    }

    @Nested
    @DisplayName("Actions and rule types")
    class ActionsAndRules {

        @ParameterizedTest
        @ValueSource(strings = {"Blocked", "BLOCK", "block", "blocked"})
        @DisplayName("Should map block synonyms to block")
        void shouldNormalizeBlock(String raw) {
            assertThat(normalized(record("RayID", "r1", "timestamp", 1_700_000_000L, "action", raw)).getAction())
                .isEqualTo(WafAction.BLOCK);
        }

        @Test
        @DisplayName("Should map challenge, log, skip and allow synonyms")
        void shouldNormalizeSynonyms() {
            assertThat(WafAction.normalize("managed_challenge")).isEqualTo(WafAction.CHALLENGE);
            assertThat(WafAction.normalize("JS-Challenge")).isEqualTo(WafAction.CHALLENGE);
            assertThat(WafAction.normalize("Logged")).isEqualTo(WafAction.LOG);
            assertThat(WafAction.normalize("bypass")).isEqualTo(WafAction.SKIP);
            assertThat(WafAction.normalize("pass")).isEqualTo(WafAction.ALLOW);
        }

        @Test
        @DisplayName("Should map unrecognized and missing actions to unknown")
        void shouldNormalizeUnknownAction() {
            assertThat(normalized(record("RayID", "r1", "timestamp", 1_700_000_000L, "action", "quarantine")).getAction())
                .isEqualTo(WafAction.UNKNOWN);
            assertThat(normalized(record("RayID", "r1", "timestamp", 1_700_000_000L)).getAction())
                .isEqualTo(WafAction.UNKNOWN);
        }

        @Test
        @DisplayName("Should use the first element of the match lists")
        void shouldUsePrimaryMatch() {
            WafEvent event = normalized(record(
                "RayID", "r1",
                "timestamp", 1_700_000_000L,
                "FirewallMatchesRuleIDs", List.of("custom_geo", "managed_xss"),
                "FirewallMatchesActions", List.of("challenge", "block"),
                "FirewallMatchesSources", List.of("firewallrules", "waf"),
                "rule_id", "ignored",
                "action", "log"));

            assertThat(event.getRuleId()).isEqualTo("custom_geo");
            assertThat(event.getAction()).isEqualTo(WafAction.CHALLENGE);
            assertThat(event.getService()).isEqualTo("firewallrules");
            assertThat(event.getRuleType()).isEqualTo(RuleType.CUSTOM);
        }

        @Test
        @DisplayName("Should fall back to scalar aliases when no match list is present")
        void shouldFallBackToScalar() {
            WafEvent event = normalized(record(
                "RayID", "r1",
                "timestamp", 1_700_000_000L,
                "FirewallMatchesRuleIDs", List.of(),
                "WAFRuleID", "100015",
                "WAFAction", "drop"));

            assertThat(event.getRuleId()).isEqualTo("100015");
            assertThat(event.getAction()).isEqualTo(WafAction.UNKNOWN);
        }

        @Test
        @DisplayName("Should infer managed, custom and unknown rule types")
        void shouldInferRuleType() {
            assertThat(RuleType.infer("managed_sqli", null)).isEqualTo(RuleType.MANAGED);
            assertThat(RuleType.infer("949110_OWASP", null)).isEqualTo(RuleType.MANAGED);
            assertThat(RuleType.infer("x-cloudflare-1", null)).isEqualTo(RuleType.MANAGED);
            assertThat(RuleType.infer("100015", "managed")).isEqualTo(RuleType.MANAGED);
            assertThat(RuleType.infer("custom_block_tor", null)).isEqualTo(RuleType.CUSTOM);
            assertThat(RuleType.infer("abc", "custom")).isEqualTo(RuleType.CUSTOM);
            assertThat(RuleType.infer("abc", "waf")).isEqualTo(RuleType.UNKNOWN);
            assertThat(RuleType.infer(null, "managed")).isEqualTo(RuleType.UNKNOWN);
        }
    }

    @Nested
    @DisplayName("Field aliases and coercion")
    class FieldAliases {

        @Test
        @DisplayName("Should resolve every field independently across mixed casing")
        void shouldResolveMixedCasing() {
            WafEvent event = normalized(record(
                "rayName", "ray-9",
                "edgeStartTimestamp", 1_700_000_000_000L,
                "client_ip", "198.51.100.4",
                "ClientCountry", "FR",
                "clientAsn", "16276",
                "datacenter", "CDG",
                "hostname", "shop.example.com",
                "uri", "/cart",
                "ClientRequestMethod", "GET",
                "edge_response_status", "403",
                "wafRuleMessage", "XSS attempt",
                "MitigationReason", "score",
                "userAgent", "curl/8.0",
                "ja3Hash", "e7d705a3286e19ea42f587b344ee6865",
                "client_request_bytes", 512,
                "securityLevel", "medium"));

            assertThat(event.getRayId()).isEqualTo("ray-9");
            assertThat(event.getSrcIp()).isEqualTo("198.51.100.4");
            assertThat(event.getSrcCountry()).isEqualTo("FR");
            assertThat(event.getSrcAsn()).isEqualTo(16276L);
            assertThat(event.getColo()).isEqualTo("CDG");
            assertThat(event.getHost()).isEqualTo("shop.example.com");
            assertThat(event.getPath()).isEqualTo("/cart");
            assertThat(event.getMethod()).isEqualTo("GET");
            assertThat(event.getStatus()).isEqualTo(403);
            assertThat(event.getRuleName()).isEqualTo("XSS attempt");
            assertThat(event.getMitigationReason()).isEqualTo("score");
            assertThat(event.getUserAgent()).isEqualTo("curl/8.0");
            assertThat(event.getJa3()).isEqualTo("e7d705a3286e19ea42f587b344ee6865");
            assertThat(event.getBytes()).isEqualTo(512L);
            assertThat(event.getThreatScore()).isNull();
        }

        @Test
        @DisplayName("Should prefer earlier aliases and skip empty values")
        void shouldPreferEarlierNonEmptyAlias() {
            WafEvent event = normalized(record(
                "RayID", "r1",
                "timestamp", 1_700_000_000L,
                "ClientIP", "",
                "clientIP", "192.0.2.10",
                "client_ip", "192.0.2.20"));

            assertThat(event.getSrcIp()).isEqualTo("192.0.2.10");
        }

        @Test
        @DisplayName("Should leave non-numeric numbers absent instead of zero")
        void shouldNotDefaultNumbersToZero() {
            WafEvent event = normalized(record(
                "RayID", "r1",
                "timestamp", 1_700_000_000L,
                "ClientASN", "AS13335",
                "EdgeResponseStatus", "n/a",
                "bytes", true));

            assertThat(event.getSrcAsn()).isNull();
            assertThat(event.getStatus()).isNull();
            assertThat(event.getBytes()).isNull();
        }

        @Test
        @DisplayName("Should truncate fractional numeric strings to their integral part")
        void shouldTruncateFractions() {
            WafEvent event = normalized(record(
                "RayID", "r1",
                "timestamp", 1_700_000_000L,
                "threat_score", "42.9",
                "bytes", 10.7));

            assertThat(event.getThreatScore()).isEqualTo(42L);
            assertThat(event.getBytes()).isEqualTo(10L);
        }

        @Test
        @DisplayName("Should treat non-string values of string fields as absent")
        void shouldIgnoreNonStringText() {
            WafEvent event = normalized(record(
                "RayID", "r1",
                "timestamp", 1_700_000_000L,
                "ClientIP", 3232235777L,
                "host", Map.of("name", "x")));

            assertThat(event.getSrcIp()).isNull();
            assertThat(event.getHost()).isNull();
        }
    }
}
