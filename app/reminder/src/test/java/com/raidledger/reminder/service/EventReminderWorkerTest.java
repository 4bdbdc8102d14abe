package com.raidledger.reminder.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.raidledger.reminder.config.ReminderScheduleProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EventReminderWorkerTest {

  @Mock private EventReminderService eventReminderService;
  @Mock private CronJobService cronJobService;

  @Test
  void schedulesBothTicksWithTheirHandlers() {
    final EventReminderWorker worker =
        new EventReminderWorker(
            eventReminderService,
            cronJobService,
            new ReminderScheduleProperties(true, "0 * * * * *", true, "0 */15 * * * *"));

    worker.scheduleJobs();

    final ArgumentCaptor<Runnable> windowTask = ArgumentCaptor.forClass(Runnable.class);
    final ArgumentCaptor<Runnable> dayOfTask = ArgumentCaptor.forClass(Runnable.class);
    verify(cronJobService)
        .scheduleJob(
            eq(EventReminderWorker.WINDOW_JOB),
            anyString(),
            eq("0 * * * * *"),
            windowTask.capture());
    verify(cronJobService)
        .scheduleJob(
            eq(EventReminderWorker.DAY_OF_JOB),
            anyString(),
            eq("0 */15 * * * *"),
            dayOfTask.capture());

    windowTask.getValue().run();
    dayOfTask.getValue().run();
    verify(eventReminderService).handleReminders();
    verify(eventReminderService).handleDayOfReminders();
  }

  @Test
  void disabledDayOfTickIsNeverScheduled() {
    final EventReminderWorker worker =
        new EventReminderWorker(
            eventReminderService,
            cronJobService,
            new ReminderScheduleProperties(true, "0 * * * * *", false, "0 */15 * * * *"));

    worker.scheduleJobs();

    verify(cronJobService)
        .scheduleJob(eq(EventReminderWorker.WINDOW_JOB), anyString(), anyString(), any());
    verify(cronJobService, never())
        .scheduleJob(eq(EventReminderWorker.DAY_OF_JOB), anyString(), anyString(), any());
  }
}
