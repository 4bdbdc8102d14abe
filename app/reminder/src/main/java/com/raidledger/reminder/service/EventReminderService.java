/*
 * Where: Reminder service layer
 * What: The two reminder ticks: the rolling lead-time windows and the local-morning day-of pass
 * Why: Both paths funnel into the same claim ledger, so whichever claims a triple first delivers
 *      and the other becomes a duplicate
 */
package com.raidledger.reminder.service;

import com.raidledger.reminder.config.ReminderPolicyProperties;
import com.raidledger.reminder.model.CharacterRecord;
import com.raidledger.reminder.model.DispatchOutcome;
import com.raidledger.reminder.model.EventSnapshot;
import com.raidledger.reminder.model.LocalDayRange;
import com.raidledger.reminder.model.ReminderInput;
import com.raidledger.reminder.model.ReminderWindow;
import com.raidledger.reminder.repository.ReminderEventRepository;
import com.raidledger.reminder.repository.UserPreferenceRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EventReminderService {

  private static final Logger logger = LoggerFactory.getLogger(EventReminderService.class);

  private final ReminderWindowRegistry windowRegistry;
  private final ReminderWindowMatcher windowMatcher;
  private final ReminderRecipientResolver recipientResolver;
  private final ReminderDispatchService dispatchService;
  private final ReminderEventRepository eventRepository;
  private final UserPreferenceRepository preferenceRepository;
  private final ReminderTimezoneResolver timezoneResolver;
  private final ReminderPolicyProperties policy;
  private final ReminderMetrics metrics;
  private final Clock clock;

  /**
   * Sends every reminder whose window has opened. Events are loaded once for the widest window
   * and matched per window in memory. Query failures propagate to the job tracker.
   */
  public void handleReminders() {
    final Instant now = Instant.now(clock);
    final List<EventSnapshot> candidates =
        eventRepository.findActiveStartingBetween(
            now.minus(policy.jitterTolerance()), now.plus(windowRegistry.maxLeadTime()));
    if (candidates.isEmpty()) {
      return;
    }
    final Map<DispatchOutcome, Integer> tally = new EnumMap<>(DispatchOutcome.class);
    for (ReminderWindow window : windowRegistry.windows()) {
      final List<EventSnapshot> due = windowMatcher.findDue(now, window, candidates);
      if (due.isEmpty()) {
        continue;
      }
      metrics.recordDueEvents(window.type(), due.size());
      for (ReminderInput input : recipientResolver.resolve(due, window, now)) {
        tally.merge(dispatchService.sendReminder(input), 1, Integer::sum);
      }
    }
    if (!tally.isEmpty()) {
      logger.info(
          "reminder window tick finished candidates={} outcomes={}", candidates.size(), tally);
    }
  }

  /**
   * Sends a 24-hour reminder for each event of the current local day to users whose local
   * clock just passed the configured morning hour.
   */
  public void handleDayOfReminders() {
    final Instant now = Instant.now(clock);
    final Map<Long, String> timezones = preferenceRepository.findAllTimezones();
    final List<Long> eligibleUsers = new ArrayList<>();
    final Map<Long, String> zoneByUser = new HashMap<>();
    for (Map.Entry<Long, String> entry : timezones.entrySet()) {
      final String zone = ReminderTimezoneResolver.normalizePreference(entry.getValue());
      if (timezoneResolver.isLocalTargetTime(
          now, zone, policy.dayOfTargetHour(), policy.dayOfAcceptanceWindow())) {
        eligibleUsers.add(entry.getKey());
        zoneByUser.put(entry.getKey(), zone);
      }
    }
    if (eligibleUsers.isEmpty()) {
      return;
    }

    final ReminderWindow window =
        windowRegistry
            .findByType(ReminderWindowRegistry.TWENTY_FOUR_HOURS)
            .orElseThrow(
                () -> new IllegalStateException("24hour reminder window is not registered"));
    final Map<Long, List<CharacterRecord>> characters =
        recipientResolver.loadCharacters(eligibleUsers);
    int sent = 0;
    for (Long userId : eligibleUsers) {
      final String zone = zoneByUser.get(userId);
      try {
        final LocalDayRange today = timezoneResolver.todayRange(now, zone);
        final List<EventSnapshot> events =
            eventRepository.findSignedUpActiveStartingBetween(userId, today.start(), today.end());
        for (EventSnapshot event : events) {
          final CharacterRecord character =
              ReminderRecipientResolver.selectCharacter(
                  characters.getOrDefault(userId, List.of()), event.gameId());
          final ReminderInput input =
              recipientResolver.toInput(event, userId, window, now, character, zone);
          if (dispatchService.sendReminder(input) == DispatchOutcome.SENT) {
            sent++;
          }
        }
      } catch (DataAccessException ex) {
        logger.warn("day-of reminders failed for user userId={} zone={}", userId, zone, ex);
      }
    }
    logger.info(
        "day-of reminder tick finished eligibleUsers={} sent={}", eligibleUsers.size(), sent);
  }
}
