package com.raidledger.reminder.model;

import java.time.Instant;

/** A local calendar day expressed as inclusive UTC instants. */
public record LocalDayRange(Instant start, Instant end) {

  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && !instant.isAfter(end);
  }
}
