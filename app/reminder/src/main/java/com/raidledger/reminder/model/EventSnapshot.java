/*
 * Where: Reminder domain model
 * What: Read-only snapshot of an events row taken once per tick
 * Why: All windows of one tick evaluate the same event data
 */
package com.raidledger.reminder.model;

import java.time.Instant;
import java.util.Set;

public record EventSnapshot(
    long id,
    String title,
    Instant startsAt,
    Instant endsAt,
    Long gameId,
    Instant cancelledAt,
    Set<ReminderFlag> enabledReminders) {

  public EventSnapshot {
    enabledReminders = enabledReminders == null ? Set.of() : Set.copyOf(enabledReminders);
  }

  public boolean isReminderEnabled(ReminderFlag flag) {
    return enabledReminders.contains(flag);
  }

  public boolean isCancelled() {
    return cancelledAt != null;
  }
}
