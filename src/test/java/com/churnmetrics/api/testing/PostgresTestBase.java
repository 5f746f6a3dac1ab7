package com.churnmetrics.api.testing;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * <p>
 * Base class for repository tests that run against a real PostgreSQL server. A single container
 * is shared by all subclasses, so that they also share one cached application context. Every test
 * runs in a transaction that is rolled back once it finishes.</p>
 *
 * <p>
 * Subclasses must be annotated with {@code @Testcontainers(disabledWithoutDocker = true)} so that
 * they are skipped on hosts without Docker.</p>
 */
@SpringBootTest
@Transactional
public abstract class PostgresTestBase {

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine");

    static {
        POSTGRES.start();
    }

    @DynamicPropertySource
    static void datasourceProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }
}
