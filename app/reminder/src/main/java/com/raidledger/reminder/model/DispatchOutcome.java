/*
 * Where: Reminder domain model
 * What: Result of one claim-and-deliver attempt
 * Why: Delivery is at-most-once; callers and metrics need to tell "already sent" from "lost"
 */
package com.raidledger.reminder.model;

import java.util.Locale;

public enum DispatchOutcome {
  /** Claimed and handed to the notification collaborator. */
  SENT,
  /** Another tick or instance already claimed the triple. */
  DUPLICATE,
  /** Claimed, but the recipient disabled this notification type. */
  OPTED_OUT,
  /** Claimed, then delivery threw. Not retried. */
  DELIVERY_FAILED,
  /** The claim itself could not be written. A later tick may retry. */
  CLAIM_FAILED;

  public String metricTag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
