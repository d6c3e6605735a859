package com.bastion.storage;

import com.bastion.domain.EventQuery;
import com.bastion.domain.RuleType;
import com.bastion.domain.WafAction;
import com.bastion.domain.WafEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;

/**
 * Repository for canonical WAF events
 */
@Repository
public class EventRepository {
    private static final Logger logger = LoggerFactory.getLogger(EventRepository.class);

    /**
     * Insert that silently skips rows violating UNIQUE(ray_id, event_ts)
     */
    static final String INSERT_OR_IGNORE = """
        INSERT OR IGNORE INTO waf_events (
            ray_id, event_ts, src_ip, src_country, src_asn, colo,
            host, path, method, status, rule_id, rule_name, rule_type,
            action, service, mitigation_reason, ua, ja3, bytes, threat_score,
            file_id, ingested_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String SELECT_COLUMNS = """
        SELECT ray_id, event_ts, src_ip, src_country, src_asn, colo,
               host, path, method, status, rule_id, rule_name, rule_type,
               action, service, mitigation_reason, ua, ja3, bytes, threat_score,
               file_id, ingested_at
        FROM waf_events
        """;

    private static final RowMapper<WafEvent> EVENT_ROW_MAPPER = new WafEventRowMapper();

    private final JdbcTemplate jdbcTemplate;

    public EventRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Insert a chunk of events as one JDBC batch.
     *
     * @param events events to insert
     * @param fileId owning upload
     * @param ingestedAt server ingestion time, epoch millis
     * @return per-row update counts; 0 means the row was suppressed as a duplicate
     */
    public int[] insertOrIgnore(List<WafEvent> events, long fileId, long ingestedAt) {
        return jdbcTemplate.batchUpdate(INSERT_OR_IGNORE, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                WafEvent event = events.get(i);
                ps.setString(1, event.getRayId());
                ps.setLong(2, event.getEventTs());
                setNullable(ps, 3, event.getSrcIp(), Types.VARCHAR);
                setNullable(ps, 4, event.getSrcCountry(), Types.VARCHAR);
                setNullable(ps, 5, event.getSrcAsn(), Types.BIGINT);
                setNullable(ps, 6, event.getColo(), Types.VARCHAR);
                setNullable(ps, 7, event.getHost(), Types.VARCHAR);
                setNullable(ps, 8, event.getPath(), Types.VARCHAR);
                setNullable(ps, 9, event.getMethod(), Types.VARCHAR);
                setNullable(ps, 10, event.getStatus(), Types.INTEGER);
                setNullable(ps, 11, event.getRuleId(), Types.VARCHAR);
                setNullable(ps, 12, event.getRuleName(), Types.VARCHAR);
                ps.setString(13, event.getRuleType().getValue());
                ps.setString(14, event.getAction().getValue());
                setNullable(ps, 15, event.getService(), Types.VARCHAR);
                setNullable(ps, 16, event.getMitigationReason(), Types.VARCHAR);
                setNullable(ps, 17, event.getUserAgent(), Types.VARCHAR);
                setNullable(ps, 18, event.getJa3(), Types.VARCHAR);
                setNullable(ps, 19, event.getBytes(), Types.BIGINT);
                setNullable(ps, 20, event.getThreatScore(), Types.BIGINT);
                ps.setLong(21, fileId);
                ps.setLong(22, ingestedAt);
            }

            @Override
            public int getBatchSize() {
                return events.size();
            }
        });
    }

    /**
     * Delete every event owned by an upload
     *
     * @return number of deleted rows
     */
    public int deleteByFileId(long fileId) {
        int deleted = jdbcTemplate.update("DELETE FROM waf_events WHERE file_id = ?", fileId);
        logger.debug("Deleted {} events for file {}", deleted, fileId);
        return deleted;
    }

    public long countByFileId(long fileId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM waf_events WHERE file_id = ?", Long.class, fileId);
        return count != null ? count : 0L;
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM waf_events", Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Events owned by an upload, in event time order
     */
    public List<WafEvent> findByFileId(long fileId) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE file_id = ? ORDER BY event_ts, ray_id",
            EVENT_ROW_MAPPER, fileId);
    }

    /**
     * Newest events matching a query, up to its limit
     */
    public List<WafEvent> search(EventQuery query) {
        List<Object> args = new ArrayList<>();
        String where = whereClause(query, args);
        args.add(query.getLimit());
        return jdbcTemplate.query(SELECT_COLUMNS + where + " ORDER BY event_ts DESC, id DESC LIMIT ?",
            EVENT_ROW_MAPPER, args.toArray());
    }

    /**
     * Number of events matching a query, ignoring its limit
     */
    public long countMatching(EventQuery query) {
        List<Object> args = new ArrayList<>();
        String where = whereClause(query, args);
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM waf_events" + where, Long.class, args.toArray());
        return count != null ? count : 0L;
    }

    private static String whereClause(EventQuery query, List<Object> args) {
        List<String> conditions = new ArrayList<>();
        addCondition(conditions, args, "event_ts >= ?", query.getStartTime());
        addCondition(conditions, args, "event_ts <= ?", query.getEndTime());
        addCondition(conditions, args, "action = ?",
            query.getAction() != null ? query.getAction().getValue() : null);
        addCondition(conditions, args, "rule_id = ?", query.getRuleId());
        addCondition(conditions, args, "host = ?", query.getHost());
        addCondition(conditions, args, "src_country = ?", query.getSrcCountry());
        addCondition(conditions, args, "colo = ?", query.getColo());
        addCondition(conditions, args, "method = ?", query.getMethod());
        addCondition(conditions, args, "status = ?", query.getStatus());

        if (query.getSearch() != null) {
            String pattern = "%" + escapeLike(query.getSearch()) + "%";
            conditions.add("(path LIKE ? ESCAPE '\\' OR ua LIKE ? ESCAPE '\\' OR host LIKE ? ESCAPE '\\')");
            args.add(pattern);
            args.add(pattern);
            args.add(pattern);
        }

        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    private static void addCondition(List<String> conditions, List<Object> args, String condition, Object value) {
        if (value != null) {
            conditions.add(condition);
            args.add(value);
        }
    }

    // Search text is matched literally
    private static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static void setNullable(PreparedStatement ps, int index, Object value, int sqlType) throws SQLException {
        if (value == null) {
            ps.setNull(index, sqlType);
        } else {
            ps.setObject(index, value, sqlType);
        }
    }

    /**
     * Row mapper for stored events
     */
    private static class WafEventRowMapper implements RowMapper<WafEvent> {
        @Override
        public WafEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            return WafEvent.builder()
                .rayId(rs.getString("ray_id"))
                .eventTs(rs.getLong("event_ts"))
                .srcIp(rs.getString("src_ip"))
                .srcCountry(rs.getString("src_country"))
                .srcAsn(nullableLong(rs, "src_asn"))
                .colo(rs.getString("colo"))
                .host(rs.getString("host"))
                .path(rs.getString("path"))
                .method(rs.getString("method"))
                .status(nullableInt(rs, "status"))
                .ruleId(rs.getString("rule_id"))
                .ruleName(rs.getString("rule_name"))
                .ruleType(RuleType.fromValue(rs.getString("rule_type")))
                .action(WafAction.fromValue(rs.getString("action")))
                .service(rs.getString("service"))
                .mitigationReason(rs.getString("mitigation_reason"))
                .userAgent(rs.getString("ua"))
                .ja3(rs.getString("ja3"))
                .bytes(nullableLong(rs, "bytes"))
                .threatScore(nullableLong(rs, "threat_score"))
                .fileId(nullableLong(rs, "file_id"))
                .ingestedAt(nullableLong(rs, "ingested_at"))
                .build();
        }

        private static Long nullableLong(ResultSet rs, String column) throws SQLException {
            long value = rs.getLong(column);
            return rs.wasNull() ? null : value;
        }

        private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
            int value = rs.getInt(column);
            return rs.wasNull() ? null : value;
        }
    }
}
