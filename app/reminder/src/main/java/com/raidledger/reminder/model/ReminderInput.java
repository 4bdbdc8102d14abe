/*
 * Where: Reminder domain model
 * What: Fully resolved data for one (event, user, window) reminder
 * Why: Dispatch needs no further per-recipient queries except the lazy timezone fallback
 */
package com.raidledger.reminder.model;

import java.time.Instant;

public record ReminderInput(
    long eventId,
    long userId,
    String windowType,
    String windowLabel,
    String title,
    Instant startsAt,
    long minutesUntil,
    String characterDisplay,
    Long gameId,
    String timezone) {

  public ReminderClaimKey claimKey() {
    return new ReminderClaimKey(eventId, userId, windowType);
  }
}
