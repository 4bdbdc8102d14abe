package com.raidledger.reminder.api;

public record CronJobScheduleRequest(String schedule) {}
