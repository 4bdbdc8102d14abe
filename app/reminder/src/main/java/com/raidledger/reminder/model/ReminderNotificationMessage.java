/*
 * Where: Reminder domain model
 * What: JSON body published to the notification stream
 */
package com.raidledger.reminder.model;

public record ReminderNotificationMessage(
    String notificationId,
    long userId,
    String type,
    String title,
    String message,
    ReminderPayload payload,
    String createdAt,
    String traceId) {}
