/*
 * Where: Reminder service layer
 * What: System-wide settings consumed by reminder formatting
 */
package com.raidledger.reminder.service;

import com.raidledger.reminder.repository.AppSettingRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SettingsService {

  static final String DEFAULT_TIMEZONE_KEY = "default_timezone";

  private final AppSettingRepository appSettingRepository;

  /** The community-wide fallback zone id, if an admin configured one. */
  public Optional<String> getDefaultTimezone() {
    return appSettingRepository
        .findValue(DEFAULT_TIMEZONE_KEY)
        .map(String::trim)
        .filter(value -> !value.isEmpty());
  }
}
