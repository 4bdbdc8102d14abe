/*
 * Where: Reminder debug API
 * What: Exposes the sent-reminder ledger and the tracked job state
 * Why: Lets operators see why a reminder did or did not go out and pause a misbehaving tick
 */
package com.raidledger.reminder.api;

import com.raidledger.reminder.repository.ReminderClaimRepository;
import com.raidledger.reminder.service.CronJobService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/reminder")
@RequiredArgsConstructor
public class ReminderDebugController {

  private static final int SENT_LIMIT = 100;

  private final ReminderClaimRepository claimRepository;
  private final CronJobService cronJobService;

  @GetMapping("/sent/{userId}")
  public SentReminderResponse sent(@PathVariable("userId") long userId) {
    final List<SentReminderResponse.SentReminderItem> items =
        claimRepository.findByUserId(userId, SENT_LIMIT).stream()
            .map(
                record ->
                    new SentReminderResponse.SentReminderItem(
                        record.eventId(), record.reminderType(), record.sentAt()))
            .toList();
    return new SentReminderResponse(userId, items);
  }

  @GetMapping("/cron-jobs")
  public List<CronJobResponse> cronJobs() {
    return cronJobService.listJobs().stream().map(CronJobResponse::from).toList();
  }

  @GetMapping("/cron-jobs/{name}/executions")
  public List<CronJobExecutionResponse> executions(
      @PathVariable("name") String name,
      @RequestParam(name = "limit", defaultValue = "20") int limit) {
    return cronJobService.executionHistory(name, limit).stream()
        .map(CronJobExecutionResponse::from)
        .toList();
  }

  @PostMapping("/cron-jobs/{name}/run")
  public CronJobResponse run(@PathVariable("name") String name) {
    return CronJobResponse.from(cronJobService.trigger(name));
  }

  @PutMapping("/cron-jobs/{name}/schedule")
  public CronJobResponse updateSchedule(
      @PathVariable("name") String name, @RequestBody CronJobScheduleRequest request) {
    return CronJobResponse.from(cronJobService.updateSchedule(name, request.schedule()));
  }

  @PostMapping("/cron-jobs/{name}/pause")
  public CronJobStateResponse pause(@PathVariable("name") String name) {
    cronJobService.pause(name);
    return new CronJobStateResponse(name, true);
  }

  @PostMapping("/cron-jobs/{name}/resume")
  public CronJobStateResponse resume(@PathVariable("name") String name) {
    cronJobService.resume(name);
    return new CronJobStateResponse(name, false);
  }
}
