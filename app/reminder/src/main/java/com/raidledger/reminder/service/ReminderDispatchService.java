/*
 * Where: Reminder service layer
 * What: Claims an (event, user, window) triple and hands the reminder to the notification gateway
 * Why: The claim commits before delivery, so a reminder is sent at most once even when ticks or
 *      instances overlap; a delivery failure after the claim is lost, not retried
 */
package com.raidledger.reminder.service;

import com.google.common.annotations.VisibleForTesting;
import com.raidledger.reminder.config.ReminderPolicyProperties;
import com.raidledger.reminder.model.DeliveredNotification;
import com.raidledger.reminder.model.DispatchOutcome;
import com.raidledger.reminder.model.ReminderInput;
import com.raidledger.reminder.model.ReminderNotification;
import com.raidledger.reminder.model.ReminderPayload;
import java.time.ZoneId;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReminderDispatchService {

  private static final Logger logger = LoggerFactory.getLogger(ReminderDispatchService.class);

  private final ClaimStore claimStore;
  private final ReminderTimezoneResolver timezoneResolver;
  private final ReminderMessageComposer messageComposer;
  private final EventEmbedService eventEmbedService;
  private final NotificationGateway notificationGateway;
  private final ReminderPolicyProperties policy;
  private final ReminderMetrics metrics;

  public DispatchOutcome sendReminder(ReminderInput input) {
    final DispatchOutcome outcome = dispatch(input);
    metrics.recordDispatch(outcome);
    return outcome;
  }

  private DispatchOutcome dispatch(ReminderInput input) {
    final boolean claimed;
    try {
      claimed = claimStore.tryClaim(input.claimKey());
    } catch (DataAccessException ex) {
      logger.warn(
          "reminder claim failed eventId={} userId={} window={}",
          input.eventId(),
          input.userId(),
          input.windowType(),
          ex);
      return DispatchOutcome.CLAIM_FAILED;
    }
    if (!claimed) {
      logger.debug(
          "reminder already claimed eventId={} userId={} window={}",
          input.eventId(),
          input.userId(),
          input.windowType());
      return DispatchOutcome.DUPLICATE;
    }

    try {
      final Optional<DeliveredNotification> delivered =
          notificationGateway.create(buildNotification(input));
      if (delivered.isEmpty()) {
        logger.debug(
            "reminder suppressed by recipient preference eventId={} userId={} window={}",
            input.eventId(),
            input.userId(),
            input.windowType());
        return DispatchOutcome.OPTED_OUT;
      }
      logger.info(
          "reminder sent eventId={} userId={} window={} notificationId={}",
          input.eventId(),
          input.userId(),
          input.windowType(),
          delivered.get().notificationId());
      return DispatchOutcome.SENT;
    } catch (RuntimeException ex) {
      logger.warn(
          "reminder delivery failed after claim; not retried eventId={} userId={} window={}",
          input.eventId(),
          input.userId(),
          input.windowType(),
          ex);
      return DispatchOutcome.DELIVERY_FAILED;
    }
  }

  @VisibleForTesting
  ReminderNotification buildNotification(ReminderInput input) {
    final ZoneId zone = timezoneResolver.resolveZone(input.timezone());
    final String localTime = timezoneResolver.formatLocalTime(input.startsAt(), zone);
    final String discordUrl =
        lookupOptional(
            "discordUrl", input, () -> eventEmbedService.getDiscordEmbedUrl(input.eventId()));
    final String voiceChannelId =
        lookupOptional(
            "voiceChannelId", input, () -> eventEmbedService.resolveVoiceChannelId(input.gameId()));
    final ReminderPayload payload =
        new ReminderPayload(
            input.eventId(),
            input.windowType(),
            input.characterDisplay(),
            discordUrl,
            voiceChannelId);
    return new ReminderNotification(
        input.userId(),
        policy.notificationType(),
        messageComposer.composeTitle(input.windowLabel()),
        messageComposer.composeMessage(input.title(), localTime, input.minutesUntil()),
        payload);
  }

  private String lookupOptional(
      String field, ReminderInput input, Supplier<Optional<String>> lookup) {
    try {
      return lookup.get().orElse(null);
    } catch (RuntimeException ex) {
      logger.warn(
          "reminder enrichment lookup failed; field omitted field={} eventId={}",
          field,
          input.eventId(),
          ex);
      return null;
    }
  }
}
