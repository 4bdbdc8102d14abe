/*
 * Where: Reminder scheduled worker
 * What: Schedules the window tick and the day-of tick through the job tracker once the
 *       application is ready
 */
package com.raidledger.reminder.service;

import com.raidledger.reminder.config.ReminderScheduleProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "reminder.schedule.enabled",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class EventReminderWorker {

  static final String WINDOW_JOB = "EventReminderService_handleReminders";
  static final String DAY_OF_JOB = "EventReminderService_handleDayOfReminders";

  private final EventReminderService eventReminderService;
  private final CronJobService cronJobService;
  private final ReminderScheduleProperties properties;

  @EventListener(ApplicationReadyEvent.class)
  public void scheduleJobs() {
    cronJobService.scheduleJob(
        WINDOW_JOB,
        "Sends event reminders as their lead-time windows open",
        properties.windowCron(),
        eventReminderService::handleReminders);
    if (properties.dayOfEnabled()) {
      cronJobService.scheduleJob(
          DAY_OF_JOB,
          "Sends morning-of reminders for today's events",
          properties.dayOfCron(),
          eventReminderService::handleDayOfReminders);
    }
  }
}
