/*
 * Where: Reminder service layer
 * What: Turns stored zone preferences into ZoneIds, local times and local calendar days
 * Why: A malformed or unsupported zone must degrade to a fallback, never fail a tick
 */
package com.raidledger.reminder.service;

import com.raidledger.reminder.model.LocalDayRange;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReminderTimezoneResolver {

  private static final Logger logger = LoggerFactory.getLogger(ReminderTimezoneResolver.class);

  static final String UTC_ID = "UTC";
  static final ZoneId UTC = ZoneId.of(UTC_ID);
  private static final String AUTO = "auto";
  private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);
  private static final DateTimeFormatter LOCAL_TIME_FORMAT =
      DateTimeFormatter.ofPattern("h:mm a z", Locale.US);

  private final SettingsService settingsService;

  /** A stored preference of "auto" (browser-detected) or an empty value is treated as UTC. */
  public static String normalizePreference(@Nullable String stored) {
    if (stored == null || stored.isBlank() || AUTO.equalsIgnoreCase(stored.trim())) {
      return UTC_ID;
    }
    return stored.trim();
  }

  public static Optional<ZoneId> parseZone(@Nullable String zoneId) {
    if (zoneId == null || zoneId.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(ZoneId.of(zoneId.trim()));
    } catch (DateTimeException ex) {
      return Optional.empty();
    }
  }

  /**
   * Resolves the zone a recipient sees times in: their preference, then the system default,
   * then UTC. The default is only looked up when the preference is absent or unusable.
   */
  public ZoneId resolveZone(@Nullable String preference) {
    if (preference != null) {
      final Optional<ZoneId> preferred = parseZone(preference);
      if (preferred.isPresent()) {
        return preferred.get();
      }
      logger.warn("invalid timezone preference; falling back to default zone={}", preference);
    }
    return resolveDefaultZone();
  }

  public String formatLocalTime(Instant instant, ZoneId zone) {
    return LOCAL_TIME_FORMAT.format(instant.atZone(zone));
  }

  /**
   * True when the local wall clock in {@code zoneId} is within {@code acceptanceWindow} after
   * {@code targetHour}:00. An unusable zone id is matched against UTC instead.
   */
  public boolean isLocalTargetTime(
      Instant now, String zoneId, int targetHour, Duration acceptanceWindow) {
    final ZonedDateTime local = now.atZone(parseZone(zoneId).orElse(ZoneOffset.UTC));
    return local.getHour() == targetHour && local.getMinute() < acceptanceWindow.toMinutes();
  }

  /**
   * The local calendar day containing {@code now}, from 00:00 to 23:59:59.999, converted with
   * the zone's offset at {@code now}. An unusable zone id yields the UTC day.
   */
  public LocalDayRange todayRange(Instant now, String zoneId) {
    final ZoneId zone = parseZone(zoneId).orElse(ZoneOffset.UTC);
    final ZoneOffset offset = zone.getRules().getOffset(now);
    final LocalDate today = LocalDate.ofInstant(now, zone);
    return new LocalDayRange(
        today.atStartOfDay().toInstant(offset), today.atTime(END_OF_DAY).toInstant(offset));
  }

  private ZoneId resolveDefaultZone() {
    final Optional<String> configured;
    try {
      configured = settingsService.getDefaultTimezone();
    } catch (RuntimeException ex) {
      logger.warn("default timezone lookup failed; using UTC", ex);
      return UTC;
    }
    if (configured.isEmpty()) {
      return UTC;
    }
    return parseZone(configured.get())
        .orElseGet(
            () -> {
              logger.warn("invalid default timezone setting; using UTC zone={}", configured.get());
              return UTC;
            });
  }
}
