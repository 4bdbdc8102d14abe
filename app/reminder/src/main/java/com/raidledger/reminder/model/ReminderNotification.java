package com.raidledger.reminder.model;

/** A reminder ready to be handed to the notification collaborator. */
public record ReminderNotification(
    long userId, String type, String title, String message, ReminderPayload payload) {}
