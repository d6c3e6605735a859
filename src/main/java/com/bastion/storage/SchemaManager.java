package com.bastion.storage;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Manages event store schema creation
 */
@Component
public class SchemaManager {
    private static final Logger logger = LoggerFactory.getLogger(SchemaManager.class);

    private static final String[] INDEXES = {
        "CREATE INDEX IF NOT EXISTS idx_waf_events_event_ts ON waf_events(event_ts)",
        "CREATE INDEX IF NOT EXISTS idx_waf_events_action ON waf_events(action)",
        "CREATE INDEX IF NOT EXISTS idx_waf_events_rule_id ON waf_events(rule_id)",
        "CREATE INDEX IF NOT EXISTS idx_waf_events_src_ip ON waf_events(src_ip)",
        "CREATE INDEX IF NOT EXISTS idx_waf_events_colo ON waf_events(colo)",
        "CREATE INDEX IF NOT EXISTS idx_waf_events_host ON waf_events(host)",
        "CREATE INDEX IF NOT EXISTS idx_waf_events_path ON waf_events(path)",
        "CREATE INDEX IF NOT EXISTS idx_waf_events_event_ts_action ON waf_events(event_ts, action)",
        "CREATE INDEX IF NOT EXISTS idx_waf_events_event_ts_rule_id ON waf_events(event_ts, rule_id)",
        "CREATE INDEX IF NOT EXISTS idx_waf_events_file_id ON waf_events(file_id)",
        "CREATE INDEX IF NOT EXISTS idx_path_rollup_count ON path_rollup(count DESC)",
        "CREATE INDEX IF NOT EXISTS idx_rule_rollup_count ON rule_rollup(count DESC)",
        "CREATE INDEX IF NOT EXISTS idx_ip_rollup_count ON ip_rollup(count DESC)"
    };

    private final JdbcTemplate jdbcTemplate;

    public SchemaManager(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Create tables on startup
     */
    @PostConstruct
    public void createTables() {
        try {
            createUploadsTable();
            createEventsTable();
            createRollupTables();
            for (String index : INDEXES) {
                jdbcTemplate.execute(index);
            }
            logger.info("Event store schema initialized successfully");
        } catch (Exception e) {
            logger.error("Failed to initialize event store schema", e);
            throw new IllegalStateException("Event store schema initialization failed", e);
        }
    }

    private void createUploadsTable() {
        String sql = """
            CREATE TABLE IF NOT EXISTS uploads (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                filename TEXT NOT NULL,
                checksum TEXT NOT NULL UNIQUE,
                size INTEGER NOT NULL,
                uploaded_at INTEGER NOT NULL,
                raw_key TEXT,
                total_records INTEGER NOT NULL DEFAULT 0,
                inserted_records INTEGER NOT NULL DEFAULT 0,
                deduped_records INTEGER NOT NULL DEFAULT 0
            )
            """;

        jdbcTemplate.execute(sql);
        logger.debug("Created table: uploads");
    }

    /**
     * Create waf_events with the (ray_id, event_ts) dedup constraint
     */
    private void createEventsTable() {
        String sql = """
            CREATE TABLE IF NOT EXISTS waf_events (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                ray_id TEXT NOT NULL,
                event_ts INTEGER NOT NULL,
                src_ip TEXT,
                src_country TEXT,
                src_asn INTEGER,
                colo TEXT,
                host TEXT,
                path TEXT,
                method TEXT,
                status INTEGER,
                rule_id TEXT,
                rule_name TEXT,
                rule_type TEXT NOT NULL DEFAULT 'unknown'
                    CHECK (rule_type IN ('managed', 'custom', 'unknown')),
                action TEXT NOT NULL DEFAULT 'unknown'
                    CHECK (action IN ('block', 'challenge', 'log', 'skip', 'allow', 'unknown')),
                service TEXT,
                mitigation_reason TEXT,
                ua TEXT,
                ja3 TEXT,
                bytes INTEGER,
                threat_score INTEGER,
                file_id INTEGER REFERENCES uploads(id) ON DELETE CASCADE,
                ingested_at INTEGER NOT NULL,
                UNIQUE (ray_id, event_ts)
            )
            """;

        jdbcTemplate.execute(sql);
        logger.debug("Created table: waf_events");
    }

    /**
     * Create the rollup tables. Country and ASN sets of the IP rollup live in
     * child tables so that merging two sets is a plain insert-or-ignore.
     */
    private void createRollupTables() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS daily_actions (
                date TEXT NOT NULL,
                action TEXT NOT NULL,
                count INTEGER NOT NULL DEFAULT 0,
                last_updated INTEGER,
                PRIMARY KEY (date, action)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS rule_rollup (
                rule_id TEXT PRIMARY KEY,
                rule_name TEXT,
                rule_type TEXT,
                count INTEGER NOT NULL DEFAULT 0,
                last_seen INTEGER,
                last_updated INTEGER
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS ip_rollup (
                src_ip TEXT PRIMARY KEY,
                count INTEGER NOT NULL DEFAULT 0,
                last_seen INTEGER,
                last_updated INTEGER
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS ip_rollup_countries (
                src_ip TEXT NOT NULL,
                country TEXT NOT NULL,
                PRIMARY KEY (src_ip, country)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS ip_rollup_asns (
                src_ip TEXT NOT NULL,
                asn INTEGER NOT NULL,
                PRIMARY KEY (src_ip, asn)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS path_rollup (
                path_key TEXT PRIMARY KEY,
                path TEXT NOT NULL,
                method TEXT,
                status INTEGER,
                count INTEGER NOT NULL DEFAULT 0,
                last_seen INTEGER,
                last_updated INTEGER
            )
            """);

        logger.debug("Created rollup tables");
    }
}
