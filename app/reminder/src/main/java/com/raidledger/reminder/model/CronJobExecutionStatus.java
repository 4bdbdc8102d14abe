package com.raidledger.reminder.model;

public enum CronJobExecutionStatus {
  COMPLETED,
  FAILED,
  SKIPPED
}
