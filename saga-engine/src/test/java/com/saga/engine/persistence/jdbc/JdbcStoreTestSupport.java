package com.saga.engine.persistence.jdbc;

import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * PostgreSQL setup for the JDBC store tests.
 */
final class JdbcStoreTestSupport {

    static PostgreSQLContainer<?> newContainer() {
        return new PostgreSQLContainer<>("postgres:15")
            .withDatabaseName("saga_test")
            .withUsername("test")
            .withPassword("test");
    }

    private JdbcStoreTestSupport() {
    }

    /**
     * Apply the schema and empty both tables.
     */
    static JdbcTemplate freshDatabase(PostgreSQLContainer<?> postgres) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/saga-schema.sql")).execute(dataSource);

        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.execute("TRUNCATE sagas, saga_leases");
        return jdbcTemplate;
    }
}
