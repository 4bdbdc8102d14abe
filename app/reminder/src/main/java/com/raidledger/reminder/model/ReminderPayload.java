/*
 * Where: Reminder domain model
 * What: Structured payload attached to a reminder notification
 * Why: Channel renderers link back to the event and its Discord message/voice channel
 */
package com.raidledger.reminder.model;

import com.fasterxml.jackson.annotation.JsonInclude;

public record ReminderPayload(
    long eventId,
    String reminderWindow,
    String characterDisplay,
    @JsonInclude(JsonInclude.Include.NON_NULL) String discordUrl,
    @JsonInclude(JsonInclude.Include.NON_NULL) String voiceChannelId) {}
