/*
 * Where: Reminder notification hand-off
 * What: Publishes reminder notifications to JetStream for the notification service to render
 * Why: Nats-Msg-Id carries the claim key so the stream's duplicate window guards the broker side
 */
package com.raidledger.reminder.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.raidledger.common.TraceIds;
import com.raidledger.reminder.config.ReminderNatsProperties;
import com.raidledger.reminder.model.DeliveredNotification;
import com.raidledger.reminder.model.ReminderNotification;
import com.raidledger.reminder.model.ReminderNotificationMessage;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
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
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class NatsNotificationGateway implements NotificationGateway {

  private static final Logger logger = LoggerFactory.getLogger(NatsNotificationGateway.class);
  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_NOTIFICATION_TYPE = "notification_type";
  private static final String HEADER_TRACE_ID = "trace_id";

  private final JetStream jetStream;
  private final ReminderNatsProperties natsProperties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Override
  public Optional<DeliveredNotification> create(ReminderNotification notification) {
    final Instant now = Instant.now(clock);
    final String notificationId = UUID.randomUUID().toString();
    final String traceId = TraceIds.currentOrNew();
    final ReminderNotificationMessage message =
        new ReminderNotificationMessage(
            notificationId,
            notification.userId(),
            notification.type(),
            notification.title(),
            notification.message(),
            notification.payload(),
            now.toString(),
            traceId);
    final Headers headers = new Headers();
    headers.add(HEADER_MESSAGE_ID, messageId(notification));
    headers.add(HEADER_NOTIFICATION_TYPE, notification.type());
    headers.add(HEADER_TRACE_ID, traceId);
    try {
      final PublishAck ack = jetStream.publish(natsProperties.subject(), headers, toJson(message));
      if (ack == null) {
        throw new IllegalStateException("puback is missing");
      }
      logger.debug(
          "reminder notification published notificationId={} userId={} seq={}",
          notificationId,
          notification.userId(),
          ack.getSeqno());
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to publish reminder notification", ex);
    }
    return Optional.of(
        new DeliveredNotification(notificationId, notification.userId(), notification.type(), now));
  }

  @VisibleForTesting
  static String messageId(ReminderNotification notification) {
    return "event-reminder:"
        + notification.payload().eventId()
        + ":"
        + notification.userId()
        + ":"
        + notification.payload().reminderWindow();
  }

  private byte[] toJson(ReminderNotificationMessage message) {
    try {
      return objectMapper.writeValueAsBytes(message);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize reminder notification", ex);
    }
  }
}
