/*
 * Where: Reminder application configuration binding
 * What: Matching tolerances and the legacy day-of target time
 * Why: The jitter buffer must track the tick interval, so it is configured next to it
 */
package com.raidledger.reminder.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "reminder.policy")
public record ReminderPolicyProperties(
    @NotNull Duration jitterTolerance,
    @Min(0) @Max(23) int dayOfTargetHour,
    @NotNull Duration dayOfAcceptanceWindow,
    @NotBlank String notificationType) {}
