/*
 * Where: Reminder test infrastructure
 * What: Shared Testcontainers PostgreSQL with the production Flyway migrations
 * Why: The claim ledger depends on PostgreSQL's ON CONFLICT semantics, so no in-memory database
 */
package com.raidledger.reminder;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresContainerTest {

  // one container per JVM; cached Spring contexts keep pointing at it
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  static {
    if (DockerClientFactory.instance().isDockerAvailable()) {
      POSTGRES.start();
    }
  }

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.datasource.hikari.schema", () -> "reminder");

    registry.add("spring.flyway.enabled", () -> "true");
    registry.add("spring.flyway.locations", () -> "classpath:db/migration");
    registry.add("spring.flyway.default-schema", () -> "reminder");
    registry.add("spring.flyway.schemas", () -> "reminder");
    registry.add("spring.flyway.create-schemas", () -> "true");
  }

  protected static void truncateAll(NamedParameterJdbcTemplate jdbcTemplate) {
    jdbcTemplate.update(
        """
        TRUNCATE event_reminders_sent, event_signups, characters, user_preferences,
          discord_event_messages, channel_bindings, app_settings, events, users,
          cron_job_executions, cron_jobs
        RESTART IDENTITY CASCADE
        """,
        new MapSqlParameterSource());
  }
}
