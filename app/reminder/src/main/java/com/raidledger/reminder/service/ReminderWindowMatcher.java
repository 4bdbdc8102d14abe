/*
 * Where: Reminder service layer
 * What: Decides which events are due for a reminder window at a given instant
 * Why: Ticks fire on a coarse interval, so an event stays due for a short grace period after
 *      its exact due instant; the claim ledger absorbs the resulting repeats
 */
package com.raidledger.reminder.service;

import com.raidledger.reminder.config.ReminderPolicyProperties;
import com.raidledger.reminder.model.EventSnapshot;
import com.raidledger.reminder.model.ReminderWindow;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReminderWindowMatcher {

  private final ReminderPolicyProperties policy;

  /**
   * Returns the events due for {@code window}: the window's flag is enabled and
   * {@code -jitterTolerance <= start - now <= leadTime}, both bounds inclusive.
   */
  public List<EventSnapshot> findDue(
      Instant now, ReminderWindow window, List<EventSnapshot> events) {
    final long lowerBoundMillis = -policy.jitterTolerance().toMillis();
    final long upperBoundMillis = window.leadTime().toMillis();
    return events.stream()
        .filter(event -> !event.isCancelled())
        .filter(event -> event.isReminderEnabled(window.enablementFlag()))
        .filter(
            event -> {
              final long msUntilStart = event.startsAt().toEpochMilli() - now.toEpochMilli();
              return msUntilStart >= lowerBoundMillis && msUntilStart <= upperBoundMillis;
            })
        .toList();
  }
}
