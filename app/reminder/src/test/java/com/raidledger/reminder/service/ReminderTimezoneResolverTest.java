/*
 * Where: Reminder timezone resolver tests
 * What: Verifies the preference/default/UTC fallback chain, local-time formatting and day ranges
 */
package com.raidledger.reminder.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.raidledger.reminder.model.LocalDayRange;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class ReminderTimezoneResolverTest {

  private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

  @Mock private SettingsService settingsService;

  private ReminderTimezoneResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new ReminderTimezoneResolver(settingsService);
  }

  @Test
  void normalizesAutoAndBlankToUtc() {
    assertThat(ReminderTimezoneResolver.normalizePreference("auto")).isEqualTo("UTC");
    assertThat(ReminderTimezoneResolver.normalizePreference("  ")).isEqualTo("UTC");
    assertThat(ReminderTimezoneResolver.normalizePreference(null)).isEqualTo("UTC");
    assertThat(ReminderTimezoneResolver.normalizePreference(" Europe/Berlin "))
        .isEqualTo("Europe/Berlin");
  }

  @Test
  void userPreferenceWinsWithoutConsultingDefault() {
    assertThat(resolver.resolveZone("America/New_York")).isEqualTo(NEW_YORK);
    verifyNoInteractions(settingsService);
  }

  @Test
  void missingPreferenceFallsBackToSystemDefault() {
    when(settingsService.getDefaultTimezone()).thenReturn(Optional.of("Europe/Berlin"));

    assertThat(resolver.resolveZone(null)).isEqualTo(ZoneId.of("Europe/Berlin"));
  }

  @Test
  void invalidPreferenceFallsBackToSystemDefault() {
    when(settingsService.getDefaultTimezone()).thenReturn(Optional.of("Europe/Berlin"));

    assertThat(resolver.resolveZone("Mars/Olympus_Mons")).isEqualTo(ZoneId.of("Europe/Berlin"));
  }

  @Test
  void noUsableDefaultFallsBackToUtc() {
    when(settingsService.getDefaultTimezone()).thenReturn(Optional.of("not-a-zone"));

    assertThat(resolver.resolveZone(null)).isEqualTo(ZoneId.of("UTC"));
  }

  @Test
  void settingsLookupFailureFallsBackToUtc() {
    when(settingsService.getDefaultTimezone()).thenThrow(new QueryTimeoutException("timeout"));

    assertThat(resolver.resolveZone(null)).isEqualTo(ZoneId.of("UTC"));
  }

  @Test
  void unexpectedSettingsFailureFallsBackToUtc() {
    when(settingsService.getDefaultTimezone())
        .thenThrow(new IllegalArgumentException("malformed setting row"));

    assertThat(resolver.resolveZone(null)).isEqualTo(ZoneId.of("UTC"));
  }

  @Test
  void formatsLocalTimeWithZoneAbbreviation() {
    final Instant start = Instant.parse("2026-07-01T23:00:00Z");

    assertThat(resolver.formatLocalTime(start, NEW_YORK)).isEqualTo("7:00 PM EDT");
    assertThat(resolver.formatLocalTime(start, ZoneId.of("UTC"))).startsWith("11:00 PM");
  }

  @Test
  void targetTimeMatchesOnlyWithinAcceptanceWindow() {
    // 09:14 and 09:15 in New York (EDT, UTC-4)
    final Instant inside = Instant.parse("2026-07-01T13:14:00Z");
    final Instant outside = Instant.parse("2026-07-01T13:15:00Z");

    assertThat(resolver.isLocalTargetTime(inside, "America/New_York", 9, Duration.ofMinutes(15)))
        .isTrue();
    assertThat(resolver.isLocalTargetTime(outside, "America/New_York", 9, Duration.ofMinutes(15)))
        .isFalse();
  }

  @Test
  void invalidZoneMatchesTargetTimeOnUtcClock() {
    final Instant nineUtc = Instant.parse("2026-07-01T09:05:00Z");

    assertThat(resolver.isLocalTargetTime(nineUtc, "Nowhere/City", 9, Duration.ofMinutes(15)))
        .isTrue();
  }

  @Test
  void todayRangeUsesLocalCalendarDay() {
    final Instant now = Instant.parse("2026-07-01T13:05:00Z");

    final LocalDayRange range = resolver.todayRange(now, "America/New_York");

    assertThat(range.start()).isEqualTo(Instant.parse("2026-07-01T04:00:00Z"));
    assertThat(range.end()).isEqualTo(Instant.parse("2026-07-02T03:59:59.999Z"));
    assertThat(range.contains(Instant.parse("2026-07-02T01:00:00Z"))).isTrue();
    assertThat(range.contains(Instant.parse("2026-07-02T04:00:00Z"))).isFalse();
  }

  @Test
  void todayRangeFallsBackToUtcDayForInvalidZone() {
    final LocalDayRange range =
        resolver.todayRange(Instant.parse("2026-07-01T13:05:00Z"), "Nowhere/City");

    assertThat(range.start()).isEqualTo(Instant.parse("2026-07-01T00:00:00Z"));
    assertThat(range.end()).isEqualTo(Instant.parse("2026-07-01T23:59:59.999Z"));
  }
}
