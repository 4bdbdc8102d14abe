/*
 * Where: Job tracking model
 * What: Snapshot of a cron_job_executions row
 */
package com.raidledger.reminder.model;

import java.time.Instant;

public record CronJobExecutionRecord(
    long id,
    long cronJobId,
    CronJobExecutionStatus status,
    Instant startedAt,
    Instant finishedAt,
    long durationMs,
    String error) {}
