/*
 * Where: Reminder message composer tests
 * What: Verifies the message tiers and the title format
 */
package com.raidledger.reminder.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ReminderMessageComposerTest {

  private static final String LOCAL_TIME = "7:00 PM EDT";

  private final ReminderMessageComposer composer = new ReminderMessageComposer();

  @Test
  void oneMinuteOrLessReadsAsStartingNow() {
    assertThat(composer.composeMessage("Raid Night", LOCAL_TIME, 1))
        .isEqualTo("Raid Night is starting now!");
    assertThat(composer.composeMessage("Raid Night", LOCAL_TIME, 0))
        .isEqualTo("Raid Night is starting now!");
  }

  @Test
  void upToAnHourReadsInMinutes() {
    assertThat(composer.composeMessage("Raid Night", LOCAL_TIME, 30))
        .isEqualTo("Raid Night starts in 30 minutes at 7:00 PM EDT.");
    assertThat(composer.composeMessage("Raid Night", LOCAL_TIME, 60))
        .isEqualTo("Raid Night starts in 60 minutes at 7:00 PM EDT.");
  }

  @Test
  void longerLeadTimesReadInRoundedHours() {
    assertThat(composer.composeMessage("Raid Night", LOCAL_TIME, 150))
        .isEqualTo("Raid Night starts in 3 hours at 7:00 PM EDT.");
    assertThat(composer.composeMessage("Raid Night", LOCAL_TIME, 89))
        .isEqualTo("Raid Night starts in 1 hour at 7:00 PM EDT.");
    assertThat(composer.composeMessage("Raid Night", LOCAL_TIME, 1440))
        .isEqualTo("Raid Night starts in 24 hours at 7:00 PM EDT.");
  }

  @Test
  void titleCarriesWindowLabel() {
    assertThat(composer.composeTitle("1 Hour")).isEqualTo("Event Starting in 1 Hour!");
  }
}
