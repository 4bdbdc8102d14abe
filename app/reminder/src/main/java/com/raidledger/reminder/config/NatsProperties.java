/*
 * Where: Reminder application configuration binding
 * What: NATS connection settings
 * Why: Switch brokers per environment, or turn NATS off for local runs
 */
package com.raidledger.reminder.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {}
