/*
 * Where: Reminder domain model
 * What: One event_signups row; userId is null for anonymous Discord participants
 */
package com.raidledger.reminder.model;

public record SignupRecord(long eventId, Long userId) {

  public boolean isAnonymous() {
    return userId == null;
  }
}
