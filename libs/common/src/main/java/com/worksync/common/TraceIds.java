package com.worksync.common;

import java.util.UUID;

public final class TraceIds {

  /** MDC key shared with the JSON log layout. */
  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString().replace("-", "");
  }
}
