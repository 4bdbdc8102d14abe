/*
 * Where: Reminder service layer
 * What: Ordered table of the reminder windows evaluated on every tick
 * Why: Adding a window is a data change; the matcher and dispatch stay untouched
 */
package com.raidledger.reminder.service;

import com.raidledger.reminder.model.ReminderFlag;
import com.raidledger.reminder.model.ReminderWindow;
import java.time.Duration;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class ReminderWindowRegistry {

  public static final String FIFTEEN_MINUTES = "15min";
  public static final String ONE_HOUR = "1hour";
  public static final String TWENTY_FOUR_HOURS = "24hour";

  public static final List<ReminderWindow> DEFAULT_WINDOWS =
      List.of(
          new ReminderWindow(
              FIFTEEN_MINUTES, "15 Minutes", Duration.ofMinutes(15), ReminderFlag.REMINDER_15MIN),
          new ReminderWindow(ONE_HOUR, "1 Hour", Duration.ofHours(1), ReminderFlag.REMINDER_1HOUR),
          new ReminderWindow(
              TWENTY_FOUR_HOURS, "24 Hours", Duration.ofHours(24), ReminderFlag.REMINDER_24HOUR));

  private final List<ReminderWindow> windows;

  public ReminderWindowRegistry() {
    this(DEFAULT_WINDOWS);
  }

  ReminderWindowRegistry(List<ReminderWindow> windows) {
    if (windows.isEmpty()) {
      throw new IllegalArgumentException("at least one reminder window is required");
    }
    final Set<String> types = new HashSet<>();
    for (ReminderWindow window : windows) {
      if (!types.add(window.type())) {
        throw new IllegalArgumentException("duplicate reminder window type: " + window.type());
      }
    }
    this.windows = List.copyOf(windows);
  }

  public List<ReminderWindow> windows() {
    return windows;
  }

  public Optional<ReminderWindow> findByType(String type) {
    return windows.stream().filter(window -> window.type().equals(type)).findFirst();
  }

  public Duration maxLeadTime() {
    return windows.stream()
        .map(ReminderWindow::leadTime)
        .max(Comparator.naturalOrder())
        .orElseThrow();
  }
}
