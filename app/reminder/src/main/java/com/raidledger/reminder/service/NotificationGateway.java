/*
 * Where: Reminder service layer
 * What: Hand-off point to the notification subsystem
 */
package com.raidledger.reminder.service;

import com.raidledger.reminder.model.DeliveredNotification;
import com.raidledger.reminder.model.ReminderNotification;
import java.util.Optional;

public interface NotificationGateway {

  /**
   * Delivers the reminder. Returns empty when the recipient disabled this notification type.
   * Failures surface as runtime exceptions.
   */
  Optional<DeliveredNotification> create(ReminderNotification notification);
}
