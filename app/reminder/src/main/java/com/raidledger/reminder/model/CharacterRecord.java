/*
 * Where: Reminder domain model
 * What: A user's game character used to decorate the reminder text
 */
package com.raidledger.reminder.model;

public record CharacterRecord(long userId, Long gameId, String name, String characterClass) {

  public String displayName() {
    if (characterClass == null || characterClass.isBlank()) {
      return name;
    }
    return name + " (" + characterClass + ")";
  }
}
