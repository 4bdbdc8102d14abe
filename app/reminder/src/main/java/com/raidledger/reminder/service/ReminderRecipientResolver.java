/*
 * Where: Reminder service layer
 * What: Expands due events into per-recipient reminder inputs
 * Why: Signups, users, timezones and characters are fetched in one batch per kind so a tick
 *      costs a fixed number of queries regardless of how many events are due
 */
package com.raidledger.reminder.service;

import com.google.common.annotations.VisibleForTesting;
import com.raidledger.reminder.model.CharacterRecord;
import com.raidledger.reminder.model.EventSnapshot;
import com.raidledger.reminder.model.ReminderInput;
import com.raidledger.reminder.model.ReminderWindow;
import com.raidledger.reminder.model.SignupRecord;
import com.raidledger.reminder.model.UserRecord;
import com.raidledger.reminder.repository.CharacterRepository;
import com.raidledger.reminder.repository.EventSignupRepository;
import com.raidledger.reminder.repository.ReminderUserRepository;
import com.raidledger.reminder.repository.UserPreferenceRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReminderRecipientResolver {

  private static final Logger logger = LoggerFactory.getLogger(ReminderRecipientResolver.class);

  private final EventSignupRepository signupRepository;
  private final ReminderUserRepository userRepository;
  private final UserPreferenceRepository preferenceRepository;
  private final CharacterRepository characterRepository;

  public List<ReminderInput> resolve(
      List<EventSnapshot> dueEvents, ReminderWindow window, Instant now) {
    if (dueEvents.isEmpty()) {
      return List.of();
    }
    final Map<Long, EventSnapshot> eventsById =
        dueEvents.stream()
            .collect(
                Collectors.toMap(
                    EventSnapshot::id, Function.identity(), (first, second) -> first,
                    LinkedHashMap::new));
    final List<SignupRecord> signups = signupRepository.findByEventIds(eventsById.keySet());

    final Map<Long, Set<Long>> recipientsByEvent = new LinkedHashMap<>();
    for (SignupRecord signup : signups) {
      // anonymous signups (no linked account) have nobody to notify
      if (signup.isAnonymous()) {
        continue;
      }
      recipientsByEvent
          .computeIfAbsent(signup.eventId(), ignored -> new LinkedHashSet<>())
          .add(signup.userId());
    }
    if (recipientsByEvent.isEmpty()) {
      return List.of();
    }

    final Set<Long> userIds = new LinkedHashSet<>();
    recipientsByEvent.values().forEach(userIds::addAll);
    final Map<Long, UserRecord> users =
        userRepository.findByIds(userIds).stream()
            .collect(Collectors.toMap(UserRecord::id, Function.identity()));
    final Map<Long, String> timezones = preferenceRepository.findTimezonesByUserIds(userIds);
    final Map<Long, List<CharacterRecord>> characters =
        groupCharacters(characterRepository.findByUserIds(userIds));

    final List<ReminderInput> inputs = new ArrayList<>();
    for (Map.Entry<Long, Set<Long>> entry : recipientsByEvent.entrySet()) {
      final EventSnapshot event = eventsById.get(entry.getKey());
      if (event == null) {
        continue;
      }
      for (Long userId : entry.getValue()) {
        if (!users.containsKey(userId)) {
          logger.debug("reminder recipient skipped; user missing eventId={} userId={}",
              event.id(), userId);
          continue;
        }
        inputs.add(
            toInput(
                event,
                userId,
                window,
                now,
                selectCharacter(characters.getOrDefault(userId, List.of()), event.gameId()),
                timezones.get(userId)));
      }
    }
    return inputs;
  }

  /** Builds the input for one recipient; shared with the day-of path. */
  public ReminderInput toInput(
      EventSnapshot event,
      long userId,
      ReminderWindow window,
      Instant now,
      @Nullable CharacterRecord character,
      @Nullable String rawTimezone) {
    return new ReminderInput(
        event.id(),
        userId,
        window.type(),
        window.label(),
        event.title(),
        event.startsAt(),
        minutesUntil(event.startsAt(), now),
        character == null ? null : character.displayName(),
        event.gameId(),
        rawTimezone == null ? null : ReminderTimezoneResolver.normalizePreference(rawTimezone));
  }

  public Map<Long, List<CharacterRecord>> loadCharacters(Collection<Long> userIds) {
    return groupCharacters(characterRepository.findByUserIds(userIds));
  }

  /** The character for the event's game, else the user's first character, else none. */
  @VisibleForTesting
  @Nullable
  static CharacterRecord selectCharacter(List<CharacterRecord> characters, @Nullable Long gameId) {
    if (characters.isEmpty()) {
      return null;
    }
    if (gameId != null) {
      for (CharacterRecord character : characters) {
        if (gameId.equals(character.gameId())) {
          return character;
        }
      }
    }
    return characters.get(0);
  }

  @VisibleForTesting
  static Map<Long, List<CharacterRecord>> groupCharacters(List<CharacterRecord> characters) {
    final Map<Long, List<CharacterRecord>> grouped = new LinkedHashMap<>();
    for (CharacterRecord character : characters) {
      grouped.computeIfAbsent(character.userId(), ignored -> new ArrayList<>()).add(character);
    }
    return grouped;
  }

  /** Whole minutes until start, rounded half up and never negative. */
  @VisibleForTesting
  static long minutesUntil(Instant startsAt, Instant now) {
    final long millis = Duration.between(now, startsAt).toMillis();
    return Math.max(0L, Math.round(millis / 60_000.0d));
  }
}
