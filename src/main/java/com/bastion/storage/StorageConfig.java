package com.bastion.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration for the SQLite event store.
 * Manages the connection pool, JdbcTemplate and transaction support.
 */
@Configuration
public class StorageConfig {
    private static final Logger logger = LoggerFactory.getLogger(StorageConfig.class);

    private static final String URL_PREFIX = "jdbc:sqlite:";

    @Value("${bastion.storage.sqlite.url:jdbc:sqlite:./data/bastion.db}")
    private String url;

    @Value("${bastion.storage.sqlite.pool.size:4}")
    private int poolSize;

    @Value("${bastion.storage.sqlite.busy-timeout-ms:10000}")
    private int busyTimeoutMs;

    /**
     * Create the SQLite DataSource with connection pooling
     */
    @Bean(name = "bastionDataSource")
    public DataSource bastionDataSource() {
        return createDataSource(url, poolSize, busyTimeoutMs);
    }

    /**
     * Create JdbcTemplate for event store operations
     */
    @Bean(name = "bastionJdbcTemplate")
    public JdbcTemplate bastionJdbcTemplate(DataSource bastionDataSource) {
        return new JdbcTemplate(bastionDataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource bastionDataSource) {
        return new DataSourceTransactionManager(bastionDataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    /**
     * Build a pooled SQLite DataSource.
     *
     * Foreign keys are switched on for every pooled connection so that deleting
     * an upload cascades to its events. WAL mode lets readers proceed while a
     * chunk is being written.
     *
     * @param jdbcUrl SQLite JDBC URL
     * @param maxPoolSize maximum pooled connections
     * @param busyTimeout milliseconds a writer waits on a locked database
     * @return the pooled data source
     */
    public static HikariDataSource createDataSource(String jdbcUrl, int maxPoolSize, int busyTimeout) {
        try {
            ensureParentDirectory(jdbcUrl);

            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(jdbcUrl);
            config.setDriverClassName("org.sqlite.JDBC");
            config.setPoolName("bastion-sqlite");

            // Connection pool settings
            config.setMaximumPoolSize(maxPoolSize);
            config.setMinimumIdle(1);
            config.setConnectionTimeout(30000);
            config.setIdleTimeout(600000);
            config.setMaxLifetime(1800000);

            // SQLite pragmas, applied per connection by the driver
            config.addDataSourceProperty("foreign_keys", "true");
            config.addDataSourceProperty("journal_mode", "WAL");
            config.addDataSourceProperty("busy_timeout", String.valueOf(busyTimeout));

            HikariDataSource dataSource = new HikariDataSource(config);

            logger.info("SQLite DataSource initialized: {}", jdbcUrl);
            return dataSource;

        } catch (Exception e) {
            logger.error("Failed to initialize SQLite DataSource", e);
            throw new IllegalStateException("SQLite DataSource initialization failed", e);
        }
    }

    private static void ensureParentDirectory(String jdbcUrl) throws IOException {
        if (!jdbcUrl.startsWith(URL_PREFIX)) {
            return;
        }
        String location = jdbcUrl.substring(URL_PREFIX.length());
        int query = location.indexOf('?');
        if (query >= 0) {
            location = location.substring(0, query);
        }
        if (location.isEmpty() || location.startsWith(":memory:") || location.startsWith("file:")) {
            return;
        }
        Path parent = Paths.get(location).toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
