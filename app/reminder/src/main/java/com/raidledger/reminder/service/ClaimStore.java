/*
 * Where: Reminder service layer
 * What: The idempotency gate in front of reminder delivery
 * Why: Isolates the one concurrency-critical write behind a single operation
 */
package com.raidledger.reminder.service;

import com.raidledger.reminder.model.ReminderClaimKey;

public interface ClaimStore {

  /**
   * Records the key if it has never been recorded.
   *
   * <p>Must be atomic at the storage layer: of any number of concurrent callers with the same
   * key, exactly one sees {@code true}. A key that already exists yields {@code false}, never an
   * exception.
   *
   * @return {@code true} only when this call wrote the record
   */
  boolean tryClaim(ReminderClaimKey key);
}
