package com.raidledger.reminder.model;

public record UserRecord(long id, String discordId) {}
