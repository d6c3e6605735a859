package com.bastion.analytics;

import com.bastion.analytics.RollupKeys.DailyKey;
import com.bastion.analytics.RollupKeys.PathKey;
import com.bastion.storage.IngestionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Maintains the daily action, rule, source IP and path rollups.
 *
 * Every aggregate statement is a template over a WHERE filter: the same SQL
 * folds in one upload's rows, recomputes a single bucket from the full event
 * table, or regenerates everything. Conflicting rows accumulate: counts add,
 * last_seen keeps the maximum, country and ASN sets are unioned.
 */
@Service
public class RollupUpdater {
    private static final Logger logger = LoggerFactory.getLogger(RollupUpdater.class);

    private static final String DAILY_AGGREGATE = """
        INSERT INTO daily_actions (date, action, count, last_updated)
        SELECT date(event_ts / 1000, 'unixepoch') AS day, action, COUNT(*), ?
        FROM waf_events
        WHERE %s
        GROUP BY day, action
        ON CONFLICT(date, action) DO UPDATE SET
            count = daily_actions.count + excluded.count,
            last_updated = excluded.last_updated
        """;

    private static final String RULE_AGGREGATE = """
        INSERT INTO rule_rollup (rule_id, rule_name, rule_type, count, last_seen, last_updated)
        SELECT rule_id, MAX(rule_name), MAX(rule_type), COUNT(*), MAX(event_ts), ?
        FROM waf_events
        WHERE rule_id IS NOT NULL AND %s
        GROUP BY rule_id
        ON CONFLICT(rule_id) DO UPDATE SET
            rule_name = COALESCE(excluded.rule_name, rule_rollup.rule_name),
            rule_type = COALESCE(excluded.rule_type, rule_rollup.rule_type),
            count = rule_rollup.count + excluded.count,
            last_seen = MAX(COALESCE(rule_rollup.last_seen, 0), excluded.last_seen),
            last_updated = excluded.last_updated
        """;

    private static final String IP_AGGREGATE = """
        INSERT INTO ip_rollup (src_ip, count, last_seen, last_updated)
        SELECT src_ip, COUNT(*), MAX(event_ts), ?
        FROM waf_events
        WHERE src_ip IS NOT NULL AND %s
        GROUP BY src_ip
        ON CONFLICT(src_ip) DO UPDATE SET
            count = ip_rollup.count + excluded.count,
            last_seen = MAX(COALESCE(ip_rollup.last_seen, 0), excluded.last_seen),
            last_updated = excluded.last_updated
        """;

    private static final String IP_COUNTRIES = """
        INSERT OR IGNORE INTO ip_rollup_countries (src_ip, country)
        SELECT DISTINCT src_ip, src_country
        FROM waf_events
        WHERE src_ip IS NOT NULL AND src_country IS NOT NULL AND %s
        """;

    private static final String IP_ASNS = """
        INSERT OR IGNORE INTO ip_rollup_asns (src_ip, asn)
        SELECT DISTINCT src_ip, src_asn
        FROM waf_events
        WHERE src_ip IS NOT NULL AND src_asn IS NOT NULL AND %s
        """;

    private static final String PATH_AGGREGATE = """
        INSERT INTO path_rollup (path_key, path, method, status, count, last_seen, last_updated)
        SELECT path || char(31) || COALESCE(method, '') || char(31) || COALESCE(status, ''),
               path, method, status, COUNT(*), MAX(event_ts), ?
        FROM waf_events
        WHERE path IS NOT NULL AND %s
        GROUP BY path, method, status
        ON CONFLICT(path_key) DO UPDATE SET
            count = path_rollup.count + excluded.count,
            last_seen = MAX(COALESCE(path_rollup.last_seen, 0), excluded.last_seen),
            last_updated = excluded.last_updated
        """;

    private static final String BY_FILE = "file_id = ?";
    private static final String ALL_EVENTS = "1 = 1";

    private static final List<String> ROLLUP_TABLES = List.of(
        "daily_actions", "rule_rollup", "ip_rollup", "ip_rollup_countries", "ip_rollup_asns", "path_rollup");

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final IngestionMetrics metrics;

    public RollupUpdater(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, IngestionMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
    }

    /**
     * Fold the events of one upload into the rollups.
     *
     * Must be called once per upload: calling it again for the same rows counts
     * them twice. Use {@link #refreshBuckets(RollupKeys)} when rows were replaced.
     */
    public void applyUpload(long fileId) {
        long started = System.currentTimeMillis();

        transactionTemplate.executeWithoutResult(status -> {
            long now = System.currentTimeMillis();
            jdbcTemplate.update(DAILY_AGGREGATE.formatted(BY_FILE), now, fileId);
            jdbcTemplate.update(RULE_AGGREGATE.formatted(BY_FILE), now, fileId);
            jdbcTemplate.update(IP_AGGREGATE.formatted(BY_FILE), now, fileId);
            jdbcTemplate.update(IP_COUNTRIES.formatted(BY_FILE), fileId);
            jdbcTemplate.update(IP_ASNS.formatted(BY_FILE), fileId);
            jdbcTemplate.update(PATH_AGGREGATE.formatted(BY_FILE), now, fileId);
        });

        long elapsed = System.currentTimeMillis() - started;
        metrics.recordRollup(elapsed);
        logger.debug("Applied rollups for file {} in {}ms", fileId, elapsed);
    }

    /**
     * Buckets currently fed by the events of one upload
     */
    public RollupKeys collectKeys(long fileId) {
        Set<DailyKey> dailyKeys = new HashSet<>(jdbcTemplate.query("""
                SELECT DISTINCT date(event_ts / 1000, 'unixepoch') AS day, action
                FROM waf_events WHERE file_id = ?
                """,
            (rs, rowNum) -> new DailyKey(rs.getString("day"), rs.getString("action")), fileId));

        Set<String> ruleIds = new HashSet<>(jdbcTemplate.queryForList(
            "SELECT DISTINCT rule_id FROM waf_events WHERE file_id = ? AND rule_id IS NOT NULL",
            String.class, fileId));

        Set<String> srcIps = new HashSet<>(jdbcTemplate.queryForList(
            "SELECT DISTINCT src_ip FROM waf_events WHERE file_id = ? AND src_ip IS NOT NULL",
            String.class, fileId));

        Set<PathKey> pathKeys = new HashSet<>(jdbcTemplate.query("""
                SELECT DISTINCT path, method, status
                FROM waf_events WHERE file_id = ? AND path IS NOT NULL
                """,
            (rs, rowNum) -> {
                int status = rs.getInt("status");
                return new PathKey(rs.getString("path"), rs.getString("method"), rs.wasNull() ? null : status);
            }, fileId));

        return new RollupKeys(dailyKeys, ruleIds, srcIps, pathKeys);
    }

    /**
     * Recompute the given buckets from every stored event.
     *
     * Bucket rows are deleted and re-aggregated, so the result does not depend
     * on what the rollups held before. A bucket with no remaining events is
     * left absent.
     */
    public void refreshBuckets(RollupKeys keys) {
        if (keys.isEmpty()) {
            return;
        }
        long started = System.currentTimeMillis();

        transactionTemplate.executeWithoutResult(status -> {
            long now = System.currentTimeMillis();

            for (DailyKey key : keys.getDailyKeys()) {
                LocalDate day = LocalDate.parse(key.getDate());
                long dayStart = day.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
                long dayEnd = day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();

                jdbcTemplate.update("DELETE FROM daily_actions WHERE date = ? AND action = ?",
                    key.getDate(), key.getAction());
                jdbcTemplate.update(DAILY_AGGREGATE.formatted("event_ts >= ? AND event_ts < ? AND action = ?"),
                    now, dayStart, dayEnd, key.getAction());
            }

            for (String ruleId : keys.getRuleIds()) {
                jdbcTemplate.update("DELETE FROM rule_rollup WHERE rule_id = ?", ruleId);
                jdbcTemplate.update(RULE_AGGREGATE.formatted("rule_id = ?"), now, ruleId);
            }

            for (String srcIp : keys.getSrcIps()) {
                jdbcTemplate.update("DELETE FROM ip_rollup WHERE src_ip = ?", srcIp);
                jdbcTemplate.update("DELETE FROM ip_rollup_countries WHERE src_ip = ?", srcIp);
                jdbcTemplate.update("DELETE FROM ip_rollup_asns WHERE src_ip = ?", srcIp);
                jdbcTemplate.update(IP_AGGREGATE.formatted("src_ip = ?"), now, srcIp);
                jdbcTemplate.update(IP_COUNTRIES.formatted("src_ip = ?"), srcIp);
                jdbcTemplate.update(IP_ASNS.formatted("src_ip = ?"), srcIp);
            }

            String pathFilter = "path = ? AND method IS ? AND status IS ?";
            for (PathKey key : keys.getPathKeys()) {
                jdbcTemplate.update("DELETE FROM path_rollup WHERE " + pathFilter,
                    key.getPath(), key.getMethod(), key.getStatus());
                jdbcTemplate.update(PATH_AGGREGATE.formatted(pathFilter),
                    now, key.getPath(), key.getMethod(), key.getStatus());
            }
        });

        long elapsed = System.currentTimeMillis() - started;
        metrics.recordRollup(elapsed);
        logger.info("Refreshed {} rollup buckets in {}ms: {}", keys.size(), elapsed, keys);
    }

    /**
     * Drop all rollups and regenerate them from the event table
     */
    public void rebuildAll() {
        long started = System.currentTimeMillis();

        transactionTemplate.executeWithoutResult(status -> {
            for (String table : ROLLUP_TABLES) {
                jdbcTemplate.update("DELETE FROM " + table);
            }
            long now = System.currentTimeMillis();
            jdbcTemplate.update(DAILY_AGGREGATE.formatted(ALL_EVENTS), now);
            jdbcTemplate.update(RULE_AGGREGATE.formatted(ALL_EVENTS), now);
            jdbcTemplate.update(IP_AGGREGATE.formatted(ALL_EVENTS), now);
            jdbcTemplate.update(IP_COUNTRIES.formatted(ALL_EVENTS));
            jdbcTemplate.update(IP_ASNS.formatted(ALL_EVENTS));
            jdbcTemplate.update(PATH_AGGREGATE.formatted(ALL_EVENTS), now);
        });

        long elapsed = System.currentTimeMillis() - started;
        metrics.recordRollup(elapsed);
        logger.info("Rebuilt all rollups in {}ms", elapsed);
    }
}
