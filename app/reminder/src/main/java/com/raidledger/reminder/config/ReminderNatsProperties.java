/*
 * Where: Reminder application configuration binding
 * What: JetStream subject/stream that reminder notifications are published to
 * Why: Nats-Msg-Id deduplication only works when the stream's duplicate window is set
 */
package com.raidledger.reminder.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "reminder.nats")
public record ReminderNatsProperties(
    @NotBlank String subject, @NotBlank String stream, @NotNull Duration duplicateWindow) {}
