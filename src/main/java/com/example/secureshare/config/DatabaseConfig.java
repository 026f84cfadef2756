package com.example.secureshare.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.EventListener;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Database-specific startup reporting. The schema itself is created by
 * {@code spring.sql.init} from {@code db/schema-h2.sql} or {@code db/schema-mysql.sql}.
 */
@Configuration
public class DatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

    static void logDatabaseInfo(JdbcTemplate jdbcTemplate) {
        try {
            Integer usersCount = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM users", Integer.class);
            Integer filesCount = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM files", Integer.class);
            Integer linksCount = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM shared_links", Integer.class);

            log.info("Database initialized - Users: {}, Files: {}, Shared links: {}", usersCount, filesCount, linksCount);
        } catch (Exception e) {
            log.warn("Could not retrieve database statistics: {}", e.getMessage());
        }
    }

    /**
     * MySQL-specific configuration
     */
    @Configuration
    @Profile("mysql")
    static class MySQLConfig {

        private final JdbcTemplate jdbcTemplate;

        @Value("${spring.datasource.url:}")
        private String url;

        MySQLConfig(JdbcTemplate jdbcTemplate) {
            this.jdbcTemplate = jdbcTemplate;
        }

        @EventListener(ApplicationReadyEvent.class)
        public void logMySQLInfo() {
            log.info("Using MySQL database: {}", url);
            logDatabaseInfo(jdbcTemplate);
        }
    }

    /**
     * H2-specific configuration (default)
     */
    @Configuration
    @Profile("!mysql")
    static class H2Config {

        private final JdbcTemplate jdbcTemplate;

        H2Config(JdbcTemplate jdbcTemplate) {
            this.jdbcTemplate = jdbcTemplate;
        }

        @EventListener(ApplicationReadyEvent.class)
        public void logH2Info() {
            log.info("Using H2 database (embedded mode)");
            logDatabaseInfo(jdbcTemplate);
        }
    }
}
