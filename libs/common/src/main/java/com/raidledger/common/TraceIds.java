/*
 * Where: Shared tracing helpers
 * What: Creates trace ids and reads the current one from the logging MDC
 * Why: Scheduled runs and outbound messages share one correlation key
 */
package com.raidledger.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String currentOrNew() {
    final String traceId = MDC.get(MDC_KEY);
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    return newTraceId();
  }
}
