/*
 * Where: Job tracking data access
 * What: Registers tracked jobs and records their executions
 * Why: Operators see when each reminder tick last ran, how long it took and why it failed
 */
package com.raidledger.reminder.repository;

import static com.raidledger.common.JdbcTimestampUtils.toInstant;
import static com.raidledger.common.JdbcTimestampUtils.toTimestamp;

import com.raidledger.reminder.model.CronJobExecutionRecord;
import com.raidledger.reminder.model.CronJobExecutionStatus;
import com.raidledger.reminder.model.CronJobRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CronJobRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void upsert(
      String name, String description, String schedule, Instant nextRunAt, Instant now) {
    final String sql =
        """
        INSERT INTO cron_jobs (
          name, description, schedule, paused, next_run_at, created_at, updated_at
        ) VALUES (
          :name, :description, :schedule, FALSE, :nextRunAt, :now, :now
        )
        ON CONFLICT (name) DO UPDATE
        SET description = COALESCE(EXCLUDED.description, cron_jobs.description),
            schedule = EXCLUDED.schedule,
            next_run_at = EXCLUDED.next_run_at,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("description", description)
            .addValue("schedule", schedule)
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  public Optional<CronJobRecord> findByName(String name) {
    final String sql =
        """
        SELECT id, name, description, schedule, paused, last_run_at, next_run_at,
               created_at, updated_at
        FROM cron_jobs
        WHERE name = :name
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("name", name), this::mapJob)
        .stream()
        .findFirst();
  }

  public List<CronJobRecord> findAll() {
    final String sql =
        """
        SELECT id, name, description, schedule, paused, last_run_at, next_run_at,
               created_at, updated_at
        FROM cron_jobs
        ORDER BY name
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapJob);
  }

  public int updatePaused(String name, boolean paused, Instant now) {
    final String sql =
        """
        UPDATE cron_jobs
        SET paused = :paused,
            updated_at = :now
        WHERE name = :name
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("paused", paused)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int updateSchedule(String name, String schedule, Instant nextRunAt, Instant now) {
    final String sql =
        """
        UPDATE cron_jobs
        SET schedule = :schedule,
            next_run_at = :nextRunAt,
            updated_at = :now
        WHERE name = :name
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("schedule", schedule)
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markRun(long cronJobId, Instant lastRunAt, Instant nextRunAt) {
    final String sql =
        """
        UPDATE cron_jobs
        SET last_run_at = :lastRunAt,
            next_run_at = :nextRunAt,
            updated_at = :lastRunAt
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", cronJobId)
            .addValue("lastRunAt", toTimestamp(lastRunAt))
            .addValue("nextRunAt", toTimestamp(nextRunAt));
    return jdbcTemplate.update(sql, params);
  }

  public void insertExecution(
      long cronJobId,
      CronJobExecutionStatus status,
      Instant startedAt,
      Instant finishedAt,
      long durationMs,
      String error) {
    final String sql =
        """
        INSERT INTO cron_job_executions (
          cron_job_id, status, started_at, finished_at, duration_ms, error
        ) VALUES (
          :cronJobId, :status, :startedAt, :finishedAt, :durationMs, :error
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("cronJobId", cronJobId)
            .addValue("status", status.name())
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("durationMs", durationMs)
            .addValue("error", error);
    jdbcTemplate.update(sql, params);
  }

  public List<CronJobExecutionRecord> findExecutions(long cronJobId, int limit) {
    final String sql =
        """
        SELECT id, cron_job_id, status, started_at, finished_at, duration_ms, error
        FROM cron_job_executions
        WHERE cron_job_id = :cronJobId
        ORDER BY started_at DESC, id DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("cronJobId", cronJobId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapExecution);
  }

  public int pruneExecutions(long cronJobId, int keep) {
    // keep the newest rows; ties on started_at are broken by id
    final String sql =
        """
        DELETE FROM cron_job_executions
        WHERE cron_job_id = :cronJobId
          AND id NOT IN (
            SELECT id
            FROM cron_job_executions
            WHERE cron_job_id = :cronJobId
            ORDER BY started_at DESC, id DESC
            LIMIT :keep
          )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("cronJobId", cronJobId).addValue("keep", keep);
    return jdbcTemplate.update(sql, params);
  }

  private CronJobRecord mapJob(ResultSet rs, int rowNum) throws SQLException {
    return new CronJobRecord(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getString("schedule"),
        rs.getBoolean("paused"),
        toInstant(rs.getTimestamp("last_run_at")),
        toInstant(rs.getTimestamp("next_run_at")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private CronJobExecutionRecord mapExecution(ResultSet rs, int rowNum) throws SQLException {
    return new CronJobExecutionRecord(
        rs.getLong("id"),
        rs.getLong("cron_job_id"),
        CronJobExecutionStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("finished_at")),
        rs.getLong("duration_ms"),
        rs.getString("error"));
  }
}
