/*
 * Where: Reminder domain model
 * What: One reminder window (type key, display label, lead time, enablement flag)
 * Why: Matching logic stays generic over the configured windows
 */
package com.raidledger.reminder.model;

import java.time.Duration;
import java.util.Objects;

public record ReminderWindow(
    String type, String label, Duration leadTime, ReminderFlag enablementFlag) {

  public ReminderWindow {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(leadTime, "leadTime");
    Objects.requireNonNull(enablementFlag, "enablementFlag");
    if (leadTime.isNegative() || leadTime.isZero()) {
      throw new IllegalArgumentException("leadTime must be positive: " + type);
    }
  }
}
