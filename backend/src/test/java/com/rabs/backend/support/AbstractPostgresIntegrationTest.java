package com.rabs.backend.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import org.junit.jupiter.api.AfterEach;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for DB-backed integration tests. Flyway builds the
 * schema on context start; every table is emptied after each test.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("rabs_test")
            .withUsername("rabs")
            .withPassword("rabs");

    private static final String TRUNCATE_ALL = """
            TRUNCATE TABLE
                loom_audit_log,
                vehicle_run,
                staff_shift,
                participant_allocation,
                instance_time_slot,
                loom_instance,
                loom_settings,
                vehicle_blackout,
                staff_unavailability,
                enrollment_billing_code,
                enrollment,
                program_time_slot,
                program,
                vehicle,
                staff_availability,
                staff,
                participant,
                venue
            CASCADE
            """;

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("rabs.loom.roll.enabled", () -> "false");
    }

    @AfterEach
    void truncateTables() {
        try (Connection connection = DriverManager.getConnection(
                POSTGRES.getJdbcUrl(),
                POSTGRES.getUsername(),
                POSTGRES.getPassword());
             Statement stmt = connection.createStatement()) {
            stmt.execute(TRUNCATE_ALL);
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to reset tables after test", ex);
        }
    }
}
