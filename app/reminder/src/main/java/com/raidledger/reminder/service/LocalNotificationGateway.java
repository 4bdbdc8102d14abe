/*
 * Where: Reminder notification hand-off
 * What: Log-only delivery used when NATS is switched off (local runs, tests)
 */
package com.raidledger.reminder.service;

import com.raidledger.reminder.model.DeliveredNotification;
import com.raidledger.reminder.model.ReminderNotification;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
@RequiredArgsConstructor
public class LocalNotificationGateway implements NotificationGateway {

  private static final Logger logger = LoggerFactory.getLogger(LocalNotificationGateway.class);

  private final Clock clock;

  @Override
  public Optional<DeliveredNotification> create(ReminderNotification notification) {
    final String notificationId = UUID.randomUUID().toString();
    logger.info(
        "reminder notification created locally notificationId={} userId={} eventId={} window={}"
            + " title=\"{}\"",
        notificationId,
        notification.userId(),
        notification.payload().eventId(),
        notification.payload().reminderWindow(),
        notification.title());
    return Optional.of(
        new DeliveredNotification(
            notificationId, notification.userId(), notification.type(), Instant.now(clock)));
  }
}
