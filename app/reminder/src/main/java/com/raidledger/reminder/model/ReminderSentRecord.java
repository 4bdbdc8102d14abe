/*
 * Where: Reminder domain model
 * What: Snapshot of an event_reminders_sent row
 */
package com.raidledger.reminder.model;

import java.time.Instant;

public record ReminderSentRecord(long eventId, long userId, String reminderType, Instant sentAt) {}
