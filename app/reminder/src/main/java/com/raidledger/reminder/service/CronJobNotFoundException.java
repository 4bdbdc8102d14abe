package com.raidledger.reminder.service;

public class CronJobNotFoundException extends RuntimeException {

  public CronJobNotFoundException(String name) {
    super("cron job not found: " + name);
  }
}
