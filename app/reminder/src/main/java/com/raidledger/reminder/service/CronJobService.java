/*
 * Where: Job tracking service
 * What: Schedules tracked jobs and runs them with pause support, manual triggers, execution
 *       history and overlap protection
 * Why: A failing tick must be visible to operators without stopping the next one
 */
package com.raidledger.reminder.service;

import com.google.common.annotations.VisibleForTesting;
import com.raidledger.common.TraceIds;
import com.raidledger.reminder.config.CronJobProperties;
import com.raidledger.reminder.model.CronJobExecutionRecord;
import com.raidledger.reminder.model.CronJobExecutionStatus;
import com.raidledger.reminder.model.CronJobRecord;
import com.raidledger.reminder.repository.CronJobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CronJobService {

  private static final Logger logger = LoggerFactory.getLogger(CronJobService.class);
  static final String MDC_JOB_NAME = "job_name";
  static final String OVERLAP_MESSAGE = "previous run still in progress";
  static final String NO_HANDLER_MESSAGE = "job has no handler in this instance";

  private final CronJobRepository cronJobRepository;
  private final CronJobProperties properties;
  private final ReminderMetrics metrics;
  private final Clock clock;
  private final TaskScheduler taskScheduler;
  private final ConcurrentMap<String, ReentrantLock> runLocks = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Runnable> handlers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, ScheduledFuture<?>> schedules = new ConcurrentHashMap<>();

  /** Creates or refreshes the tracking row of a job without scheduling it. */
  public void registerJob(String name, String description, String schedule) {
    final Instant now = Instant.now(clock);
    cronJobRepository.upsert(name, description, schedule, computeNextRun(schedule, now), now);
    logger.info("cron job registered name={} schedule={}", name, schedule);
  }

  /**
   * Registers a job and fires {@code task} through {@link #executeWithTracking} on every match of
   * {@code schedule}. The configured schedule replaces any schedule stored by an earlier instance.
   */
  public void scheduleJob(String name, String description, String schedule, Runnable task) {
    registerJob(name, description, schedule);
    handlers.put(name, task);
    reschedule(name, schedule);
  }

  /**
   * Runs {@code task} under the job's tracking record. Exceptions thrown by the task are recorded
   * and logged, never rethrown. A job without a tracking row runs unrecorded, with the same
   * exception handling.
   */
  public void executeWithTracking(String name, Runnable task) {
    final ReentrantLock lock = runLocks.computeIfAbsent(name, ignored -> new ReentrantLock());
    MDC.put(MDC_JOB_NAME, name);
    MDC.put(TraceIds.MDC_KEY, TraceIds.newTraceId());
    try {
      if (!lock.tryLock()) {
        logger.warn("cron job skipped; previous run still in progress name={}", name);
        recordSkip(name, OVERLAP_MESSAGE);
        return;
      }
      try {
        runTracked(name, task);
      } finally {
        lock.unlock();
      }
    } finally {
      MDC.remove(MDC_JOB_NAME);
      MDC.remove(TraceIds.MDC_KEY);
    }
  }

  /**
   * Runs a job now on the calling thread, with the same pause and overlap rules as a scheduled
   * run.
   *
   * @return the job row after the run
   */
  public CronJobRecord trigger(String name) {
    final CronJobRecord job = findJob(name);
    final Runnable task = handlers.get(name);
    if (task == null) {
      logger.warn("cron job trigger skipped; no handler in this instance name={}", name);
      final Instant now = Instant.now(clock);
      cronJobRepository.insertExecution(
          job.id(), CronJobExecutionStatus.SKIPPED, now, now, 0L, NO_HANDLER_MESSAGE);
      metrics.recordJobRun(name, CronJobExecutionStatus.SKIPPED, Duration.ZERO);
      prune(job);
    } else {
      logger.info("cron job triggered manually name={}", name);
      executeWithTracking(name, task);
    }
    return findJob(name);
  }

  /**
   * Stores a new cron expression for a job and, when this instance schedules it, applies it
   * immediately. A restart reverts the job to its configured schedule.
   */
  public CronJobRecord updateSchedule(String name, String schedule) {
    if (schedule == null || !CronExpression.isValidExpression(schedule)) {
      throw new IllegalArgumentException("invalid cron expression: " + schedule);
    }
    final Instant now = Instant.now(clock);
    final int updated =
        cronJobRepository.updateSchedule(name, schedule, computeNextRun(schedule, now), now);
    if (updated == 0) {
      throw new CronJobNotFoundException(name);
    }
    if (handlers.containsKey(name)) {
      reschedule(name, schedule);
    }
    logger.info("cron job schedule updated name={} schedule={}", name, schedule);
    return findJob(name);
  }

  public void pause(String name) {
    setPaused(name, true);
  }

  public void resume(String name) {
    setPaused(name, false);
  }

  public List<CronJobRecord> listJobs() {
    return cronJobRepository.findAll();
  }

  public List<CronJobExecutionRecord> executionHistory(String name, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    final CronJobRecord job = findJob(name);
    return cronJobRepository.findExecutions(
        job.id(), Math.min(limit, properties.maxExecutionsPerJob()));
  }

  private void runTracked(String name, Runnable task) {
    final Optional<CronJobRecord> registered = cronJobRepository.findByName(name);
    if (registered.isEmpty()) {
      try {
        task.run();
      } catch (RuntimeException ex) {
        logger.error("untracked cron job failed name={}", name, ex);
      }
      return;
    }
    final CronJobRecord job = registered.get();
    if (job.paused()) {
      logger.debug("cron job paused; run skipped name={}", name);
      final Instant now = Instant.now(clock);
      cronJobRepository.insertExecution(
          job.id(), CronJobExecutionStatus.SKIPPED, now, now, 0L, null);
      metrics.recordJobRun(name, CronJobExecutionStatus.SKIPPED, Duration.ZERO);
      prune(job);
      return;
    }

    final Instant startedAt = Instant.now(clock);
    CronJobExecutionStatus status = CronJobExecutionStatus.COMPLETED;
    String error = null;
    try {
      task.run();
    } catch (RuntimeException ex) {
      status = CronJobExecutionStatus.FAILED;
      error = truncateError(ex.getMessage() == null ? ex.getClass().getName() : ex.getMessage());
      logger.error("cron job failed name={}", name, ex);
    }
    final Instant finishedAt = Instant.now(clock);
    final Duration duration = Duration.between(startedAt, finishedAt);
    cronJobRepository.insertExecution(
        job.id(), status, startedAt, finishedAt, duration.toMillis(), error);
    cronJobRepository.markRun(job.id(), finishedAt, computeNextRun(job.schedule(), finishedAt));
    metrics.recordJobRun(name, status, duration);
    prune(job);
  }

  @VisibleForTesting
  static Instant computeNextRun(String schedule, Instant from) {
    try {
      // CronTrigger evaluates in the JVM default zone
      final ZonedDateTime next =
          CronExpression.parse(schedule).next(from.atZone(ZoneId.systemDefault()));
      return next == null ? null : next.toInstant();
    } catch (IllegalArgumentException ex) {
      return null;
    }
  }

  private void reschedule(String name, String schedule) {
    final Runnable task = handlers.get(name);
    final ScheduledFuture<?> future =
        taskScheduler.schedule(() -> executeWithTracking(name, task), new CronTrigger(schedule));
    final ScheduledFuture<?> previous = schedules.put(name, future);
    if (previous != null) {
      previous.cancel(false);
    }
  }

  private CronJobRecord findJob(String name) {
    return cronJobRepository.findByName(name).orElseThrow(() -> new CronJobNotFoundException(name));
  }

  private void recordSkip(String name, String reason) {
    try {
      cronJobRepository
          .findByName(name)
          .ifPresent(
              job -> {
                final Instant now = Instant.now(clock);
                cronJobRepository.insertExecution(
                    job.id(), CronJobExecutionStatus.SKIPPED, now, now, 0L, reason);
              });
      metrics.recordJobRun(name, CronJobExecutionStatus.SKIPPED, Duration.ZERO);
    } catch (DataAccessException ex) {
      logger.warn("failed to record skipped cron job run name={}", name, ex);
    }
  }

  private void prune(CronJobRecord job) {
    try {
      cronJobRepository.pruneExecutions(job.id(), properties.maxExecutionsPerJob());
    } catch (DataAccessException ex) {
      logger.warn("cron job history pruning failed name={}", job.name(), ex);
    }
  }

  private void setPaused(String name, boolean paused) {
    final int updated = cronJobRepository.updatePaused(name, paused, Instant.now(clock));
    if (updated == 0) {
      throw new CronJobNotFoundException(name);
    }
    logger.info("cron job {} name={}", paused ? "paused" : "resumed", name);
  }

  private String truncateError(String message) {
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
