/*
 * Where: Job tracking model
 * What: Snapshot of a cron_jobs row
 */
package com.raidledger.reminder.model;

import java.time.Instant;

public record CronJobRecord(
    long id,
    String name,
    String description,
    String schedule,
    boolean paused,
    Instant lastRunAt,
    Instant nextRunAt,
    Instant createdAt,
    Instant updatedAt) {}
