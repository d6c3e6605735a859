package com.bastion.analytics;

import com.bastion.domain.AttackPath;
import com.bastion.domain.HostCount;
import com.bastion.domain.RuleType;
import com.bastion.domain.TimeSeriesPoint;
import com.bastion.domain.TopRule;
import com.bastion.domain.WafAction;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates computed straight from the event table over [startTime, endTime].
 *
 * Unlike the rollups these honor an arbitrary time range, at the cost of a
 * scan over the event_ts index.
 */
@Repository
public class EventAnalyticsRepository {

    private final JdbcTemplate jdbcTemplate;

    public EventAnalyticsRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public long countEvents(long startTime, long endTime) {
        return count("SELECT COUNT(*) FROM waf_events WHERE event_ts >= ? AND event_ts <= ?", startTime, endTime);
    }

    public long countUniqueIps(long startTime, long endTime) {
        return count("SELECT COUNT(DISTINCT src_ip) FROM waf_events WHERE event_ts >= ? AND event_ts <= ?",
            startTime, endTime);
    }

    public Map<WafAction, Long> countByAction(long startTime, long endTime) {
        Map<WafAction, Long> counts = new EnumMap<>(WafAction.class);
        jdbcTemplate.query("""
                SELECT action, COUNT(*) AS count
                FROM waf_events
                WHERE event_ts >= ? AND event_ts <= ?
                GROUP BY action
                """,
            rs -> {
                counts.merge(WafAction.fromValue(rs.getString("action")), rs.getLong("count"), Long::sum);
            },
            startTime, endTime);
        return counts;
    }

    public List<TopRule> topRules(long startTime, long endTime, int limit) {
        return jdbcTemplate.query("""
                SELECT rule_id, MAX(rule_name) AS rule_name, MAX(rule_type) AS rule_type,
                       COUNT(*) AS count, MAX(event_ts) AS last_seen
                FROM waf_events
                WHERE event_ts >= ? AND event_ts <= ? AND rule_id IS NOT NULL
                GROUP BY rule_id
                ORDER BY count DESC, rule_id
                LIMIT ?
                """,
            (rs, rowNum) -> new TopRule(
                rs.getString("rule_id"),
                rs.getString("rule_name"),
                RuleType.fromValue(rs.getString("rule_type")),
                rs.getLong("count"),
                rs.getLong("last_seen")),
            startTime, endTime, limit);
    }

    public List<HostCount> topHosts(long startTime, long endTime, int limit) {
        return jdbcTemplate.query("""
                SELECT host, COUNT(*) AS count
                FROM waf_events
                WHERE event_ts >= ? AND event_ts <= ? AND host IS NOT NULL
                GROUP BY host
                ORDER BY count DESC, host
                LIMIT ?
                """,
            (rs, rowNum) -> new HostCount(rs.getString("host"), rs.getLong("count")),
            startTime, endTime, limit);
    }

    public List<AttackPath> topPaths(long startTime, long endTime, int limit) {
        return jdbcTemplate.query("""
                SELECT path, method, status, COUNT(*) AS count, MAX(event_ts) AS last_seen
                FROM waf_events
                WHERE event_ts >= ? AND event_ts <= ? AND path IS NOT NULL
                GROUP BY path, method, status
                ORDER BY count DESC, path
                LIMIT ?
                """,
            (rs, rowNum) -> new AttackPath(
                rs.getString("path"),
                rs.getString("method"),
                nullableInt(rs, "status"),
                rs.getLong("count"),
                rs.getLong("last_seen")),
            startTime, endTime, limit);
    }

    /**
     * Event counts per source country, largest first
     */
    public Map<String, Long> countByCountry(long startTime, long endTime, int limit) {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbcTemplate.query("""
                SELECT src_country, COUNT(*) AS count
                FROM waf_events
                WHERE event_ts >= ? AND event_ts <= ? AND src_country IS NOT NULL
                GROUP BY src_country
                ORDER BY count DESC, src_country
                LIMIT ?
                """,
            rs -> {
                counts.put(rs.getString("src_country"), rs.getLong("count"));
            },
            startTime, endTime, limit);
        return counts;
    }

    /**
     * Per-action counts of the non-empty buckets in the range, in time order
     *
     * @param bucketMillis bucket width; bucket starts are multiples of it since the epoch
     */
    public List<TimeSeriesPoint> bucketCounts(long startTime, long endTime, long bucketMillis) {
        Map<Long, TimeSeriesPoint> points = new LinkedHashMap<>();
        jdbcTemplate.query("""
                SELECT (event_ts / ?) * ? AS bucket, action, COUNT(*) AS count
                FROM waf_events
                WHERE event_ts >= ? AND event_ts <= ?
                GROUP BY bucket, action
                ORDER BY bucket
                """,
            rs -> {
                long bucket = rs.getLong("bucket");
                points.computeIfAbsent(bucket, TimeSeriesPoint::new)
                    .add(WafAction.fromValue(rs.getString("action")), rs.getLong("count"));
            },
            bucketMillis, bucketMillis, startTime, endTime);
        return new ArrayList<>(points.values());
    }

    private long count(String sql, Object... args) {
        Long count = jdbcTemplate.queryForObject(sql, Long.class, args);
        return count != null ? count : 0L;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
