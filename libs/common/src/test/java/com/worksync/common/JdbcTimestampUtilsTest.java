package com.worksync.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  private static final Instant BASE_TIME = Instant.parse("2026-10-19T07:00:00Z");

  @Test
  void convertsBothWaysWithoutShiftingTheInstant() {
    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(BASE_TIME);

    assertThat(timestamp.toInstant()).isEqualTo(BASE_TIME);
    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(BASE_TIME);
  }

  @Test
  void nullStaysNull() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }

  @Test
  void traceIdsAreCompactAndUnique() {
    final String first = TraceIds.newTraceId();
    final String second = TraceIds.newTraceId();

    assertThat(first).hasSize(32).doesNotContain("-");
    assertThat(first).isNotEqualTo(second);
  }
}
