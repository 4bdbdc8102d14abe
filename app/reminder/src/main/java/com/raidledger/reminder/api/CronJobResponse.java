package com.raidledger.reminder.api;

import com.raidledger.reminder.model.CronJobRecord;
import java.time.Instant;

public record CronJobResponse(
    String name,
    String description,
    String schedule,
    boolean paused,
    Instant lastRunAt,
    Instant nextRunAt) {

  static CronJobResponse from(CronJobRecord record) {
    return new CronJobResponse(
        record.name(),
        record.description(),
        record.schedule(),
        record.paused(),
        record.lastRunAt(),
        record.nextRunAt());
  }
}
