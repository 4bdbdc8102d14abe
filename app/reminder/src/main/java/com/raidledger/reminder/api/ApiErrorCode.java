package com.raidledger.reminder.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  CRON_JOB_NOT_FOUND
}
