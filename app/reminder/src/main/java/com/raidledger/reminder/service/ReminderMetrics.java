/*
 * Where: Reminder service layer
 * What: Micrometer meters for dispatch outcomes, due events and job runs
 */
package com.raidledger.reminder.service;

import com.raidledger.reminder.model.CronJobExecutionStatus;
import com.raidledger.reminder.model.DispatchOutcome;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class ReminderMetrics {

  static final String METRIC_DISPATCH_TOTAL = "reminder.dispatch.total";
  static final String METRIC_DUE_EVENTS_TOTAL = "reminder.due.events.total";
  static final String METRIC_JOB_DURATION = "reminder.job.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<DispatchOutcome, Counter> dispatchCounters =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dueEventCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> jobTimers = new ConcurrentHashMap<>();

  public ReminderMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordDispatch(DispatchOutcome outcome) {
    dispatchCounters
        .computeIfAbsent(
            outcome,
            key ->
                Counter.builder(METRIC_DISPATCH_TOTAL)
                    .description("Reminder claim-and-deliver attempts by outcome")
                    .tags(Tags.of("outcome", key.metricTag()))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDueEvents(String windowType, int count) {
    if (count <= 0) {
      return;
    }
    dueEventCounters
        .computeIfAbsent(
            windowType,
            key ->
                Counter.builder(METRIC_DUE_EVENTS_TOTAL)
                    .description("Events found due per reminder window")
                    .tags(Tags.of("window", key))
                    .register(meterRegistry))
        .increment(count);
  }

  public void recordJobRun(String jobName, CronJobExecutionStatus status, Duration duration) {
    final String statusTag = status.name().toLowerCase(Locale.ROOT);
    jobTimers
        .computeIfAbsent(
            jobName + ":" + statusTag,
            ignored ->
                Timer.builder(METRIC_JOB_DURATION)
                    .description("Tracked scheduled job run duration")
                    .tags(Tags.of("job", jobName, "status", statusTag))
                    .register(meterRegistry))
        .record(duration);
  }
}
