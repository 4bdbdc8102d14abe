package com.raidledger.reminder.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.raidledger.reminder.model.CronJobExecutionStatus;
import com.raidledger.reminder.model.DispatchOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ReminderMetricsTest {

  @Test
  void recordsDispatchDueEventsAndJobRuns() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ReminderMetrics metrics = new ReminderMetrics(registry);

    metrics.recordDispatch(DispatchOutcome.SENT);
    metrics.recordDispatch(DispatchOutcome.SENT);
    metrics.recordDispatch(DispatchOutcome.DUPLICATE);
    metrics.recordDueEvents("15min", 3);
    metrics.recordDueEvents("15min", 0);
    metrics.recordJobRun("job", CronJobExecutionStatus.FAILED, Duration.ofMillis(25));

    assertThat(registry.get("reminder.dispatch.total").tag("outcome", "sent").counter().count())
        .isEqualTo(2.0d);
    assertThat(
            registry.get("reminder.dispatch.total").tag("outcome", "duplicate").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("reminder.due.events.total").tag("window", "15min").counter().count())
        .isEqualTo(3.0d);
    assertThat(
            registry
                .get("reminder.job.duration")
                .tag("job", "job")
                .tag("status", "failed")
                .timer()
                .count())
        .isEqualTo(1L);
  }
}
