/*
 * Where: Reminder service layer
 * What: Builds the notification title and the human-readable reminder body
 */
package com.raidledger.reminder.service;

import org.springframework.stereotype.Component;

@Component
public class ReminderMessageComposer {

  public String composeTitle(String windowLabel) {
    return "Event Starting in " + windowLabel + "!";
  }

  public String composeMessage(String eventTitle, String localTime, long minutesUntil) {
    if (minutesUntil <= 1) {
      return eventTitle + " is starting now!";
    }
    if (minutesUntil <= 60) {
      return eventTitle + " starts in " + minutesUntil + " minutes at " + localTime + ".";
    }
    // half hours round up: 150 minutes reads as 3 hours
    final long hours = Math.round(minutesUntil / 60.0d);
    if (hours == 1) {
      return eventTitle + " starts in 1 hour at " + localTime + ".";
    }
    return eventTitle + " starts in " + hours + " hours at " + localTime + ".";
  }
}
