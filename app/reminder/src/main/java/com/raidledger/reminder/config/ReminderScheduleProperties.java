/*
 * Where: Reminder application configuration binding
 * What: Cron triggers of the window tick and the legacy day-of tick
 * Why: Ticks stay aligned to wall-clock minutes/quarter-hours, which the day-of acceptance
 *      window relies on, and can be switched off in tests
 */
package com.raidledger.reminder.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "reminder.schedule")
public record ReminderScheduleProperties(
    boolean enabled,
    @NotBlank String windowCron,
    boolean dayOfEnabled,
    @NotBlank String dayOfCron) {

  @AssertTrue(message = "reminder.schedule.window-cron must be a valid cron expression")
  public boolean isWindowCronValid() {
    return windowCron == null || CronExpression.isValidExpression(windowCron);
  }

  @AssertTrue(message = "reminder.schedule.day-of-cron must be a valid cron expression")
  public boolean isDayOfCronValid() {
    return dayOfCron == null || CronExpression.isValidExpression(dayOfCron);
  }
}
