/*
 * Where: Reminder NATS initialization
 * What: Creates or updates the reminder notification stream at startup
 * Why: Nats-Msg-Id deduplication needs the stream and its duplicate window in place first
 */
package com.raidledger.reminder.nats;

import com.raidledger.reminder.config.ReminderNatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class ReminderJetStreamBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(ReminderJetStreamBootstrap.class);
  private static final int NOT_FOUND_STATUS = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final ReminderNatsProperties properties;

  @PostConstruct
  public void start() {
    if (properties.duplicateWindow().isZero() || properties.duplicateWindow().isNegative()) {
      throw new IllegalStateException("reminder.nats.duplicate-window must be positive");
    }
    final StreamConfiguration configuration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    try {
      ensureStream(connection.jetStreamManagement(), configuration);
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to ensure reminder stream", ex);
    }
    logger.info(
        "reminder stream ready stream={} subject={} duplicateWindow={}",
        properties.stream(),
        properties.subject(),
        properties.duplicateWindow());
  }

  private void ensureStream(JetStreamManagement management, StreamConfiguration configuration)
      throws IOException, JetStreamApiException {
    try {
      management.updateStream(configuration);
    } catch (JetStreamApiException ex) {
      if (ex.getApiErrorCode() != STREAM_NOT_FOUND_API_ERROR
          && ex.getErrorCode() != NOT_FOUND_STATUS) {
        throw ex;
      }
      management.addStream(configuration);
    }
  }
}
