/*
 * Where: Reminder application entry point
 * What: Boots Spring, binds configuration records and enables the scheduled ticks
 */
package com.raidledger.reminder;

import com.raidledger.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class ReminderApplication {

  public static void main(String[] args) {
    SpringApplication.run(ReminderApplication.class, args);
  }
}
