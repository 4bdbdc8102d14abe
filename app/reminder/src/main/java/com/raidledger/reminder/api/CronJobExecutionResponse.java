package com.raidledger.reminder.api;

import com.raidledger.reminder.model.CronJobExecutionRecord;
import com.raidledger.reminder.model.CronJobExecutionStatus;
import java.time.Instant;

public record CronJobExecutionResponse(
    CronJobExecutionStatus status,
    Instant startedAt,
    Instant finishedAt,
    long durationMs,
    String error) {

  static CronJobExecutionResponse from(CronJobExecutionRecord record) {
    return new CronJobExecutionResponse(
        record.status(),
        record.startedAt(),
        record.finishedAt(),
        record.durationMs(),
        record.error());
  }
}
