package com.raidledger.reminder.model;

import java.time.Instant;

public record DeliveredNotification(
    String notificationId, long userId, String type, Instant createdAt) {}
