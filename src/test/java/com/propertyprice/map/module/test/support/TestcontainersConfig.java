package com.propertyprice.map.module.test.support;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * PostgreSQL container setup for tests that need the real database
 * (Flyway migrations, PostgreSQL SQL semantics).
 *
 * Usage: declare a static {@code @Container} field from {@link #postgresContainer()}
 * and call {@link #registerDatasource} from a {@code @DynamicPropertySource} method.
 */
public final class TestcontainersConfig {

    private TestcontainersConfig() {
    }

    @SuppressWarnings("resource")
    public static PostgreSQLContainer<?> postgresContainer() {
        return new PostgreSQLContainer<>(DockerImageName.parse("postgres:14-alpine"))
                .withDatabaseName("property_prices_test")
                .withUsername("test")
                .withPassword("test");
    }

    /**
     * Point the application at the container and let Flyway own the schema.
     */
    public static void registerDatasource(DynamicPropertyRegistry registry, PostgreSQLContainer<?> container) {
        registry.add("spring.datasource.url", container::getJdbcUrl);
        registry.add("spring.datasource.username", container::getUsername);
        registry.add("spring.datasource.password", container::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "validate");
        registry.add("spring.flyway.enabled", () -> "true");
    }
}
