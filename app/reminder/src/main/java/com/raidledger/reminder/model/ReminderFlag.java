/*
 * Where: Reminder domain model
 * What: Per-event boolean columns that switch a reminder window on
 * Why: Window descriptors name their flag instead of hard-coding event fields
 */
package com.raidledger.reminder.model;

public enum ReminderFlag {
  REMINDER_15MIN("reminder_15min"),
  REMINDER_1HOUR("reminder_1hour"),
  REMINDER_24HOUR("reminder_24hour");

  private final String columnName;

  ReminderFlag(String columnName) {
    this.columnName = columnName;
  }

  public String columnName() {
    return columnName;
  }
}
