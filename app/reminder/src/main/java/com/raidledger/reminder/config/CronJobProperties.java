/*
 * Where: Reminder application configuration binding
 * What: Execution history limits for tracked scheduled jobs
 */
package com.raidledger.reminder.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "reminder.cron-jobs")
public record CronJobProperties(
    @Positive int maxExecutionsPerJob, @Positive int errorMessageMaxLength) {}
