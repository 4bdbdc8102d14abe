package com.raidledger.reminder.api;

public record CronJobStateResponse(String name, boolean paused) {}
