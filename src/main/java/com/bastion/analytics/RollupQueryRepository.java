package com.bastion.analytics;

import com.bastion.domain.AttackPath;
import com.bastion.domain.DailyActionCount;
import com.bastion.domain.RuleType;
import com.bastion.domain.TopIp;
import com.bastion.domain.TopRule;
import com.bastion.domain.WafAction;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only views over the rollup tables
 */
@Repository
public class RollupQueryRepository {

    public static final int DEFAULT_LIMIT = 20;

    private final JdbcTemplate jdbcTemplate;

    public RollupQueryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<TopRule> topRules(int limit) {
        return jdbcTemplate.query("""
                SELECT rule_id, rule_name, rule_type, count, last_seen
                FROM rule_rollup
                ORDER BY count DESC, rule_id
                LIMIT ?
                """,
            (rs, rowNum) -> new TopRule(
                rs.getString("rule_id"),
                rs.getString("rule_name"),
                RuleType.fromValue(rs.getString("rule_type")),
                rs.getLong("count"),
                nullableLong(rs, "last_seen")),
            limit);
    }

    /**
     * Most active source IPs, each with the countries and ASNs it was seen from
     */
    public List<TopIp> topIps(int limit) {
        List<TopIp> rows = jdbcTemplate.query("""
                SELECT src_ip, count, last_seen
                FROM ip_rollup
                ORDER BY count DESC, src_ip
                LIMIT ?
                """,
            (rs, rowNum) -> new TopIp(rs.getString("src_ip"), rs.getLong("count"), null, null, nullableLong(rs, "last_seen")),
            limit);

        // Sets are read once the outer cursor is closed
        List<TopIp> result = new ArrayList<>(rows.size());
        for (TopIp row : rows) {
            result.add(new TopIp(
                row.getSrcIp(),
                row.getCount(),
                jdbcTemplate.queryForList(
                    "SELECT country FROM ip_rollup_countries WHERE src_ip = ? ORDER BY country",
                    String.class, row.getSrcIp()),
                jdbcTemplate.queryForList(
                    "SELECT asn FROM ip_rollup_asns WHERE src_ip = ? ORDER BY asn",
                    Long.class, row.getSrcIp()),
                row.getLastSeen()));
        }
        return result;
    }

    public List<AttackPath> topPaths(int limit) {
        return jdbcTemplate.query("""
                SELECT path, method, status, count, last_seen
                FROM path_rollup
                ORDER BY count DESC, path
                LIMIT ?
                """,
            (rs, rowNum) -> {
                int status = rs.getInt("status");
                Integer nullableStatus = rs.wasNull() ? null : status;
                return new AttackPath(
                    rs.getString("path"),
                    rs.getString("method"),
                    nullableStatus,
                    rs.getLong("count"),
                    nullableLong(rs, "last_seen"));
            },
            limit);
    }

    /**
     * Daily action counts between two UTC dates, both inclusive
     *
     * @param startDate first day, yyyy-MM-dd
     * @param endDate last day, yyyy-MM-dd
     */
    public List<DailyActionCount> dailyActions(String startDate, String endDate) {
        return jdbcTemplate.query("""
                SELECT date, action, count
                FROM daily_actions
                WHERE date >= ? AND date <= ?
                ORDER BY date, action
                """,
            (rs, rowNum) -> new DailyActionCount(
                rs.getString("date"),
                WafAction.fromValue(rs.getString("action")),
                rs.getLong("count")),
            startDate, endDate);
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
