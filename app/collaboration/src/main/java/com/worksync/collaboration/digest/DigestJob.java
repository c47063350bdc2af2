package com.worksync.collaboration.digest;

import com.worksync.collaboration.config.DigestProperties;
import com.worksync.collaboration.model.UserPreferences;

public enum DigestJob {
  MORNING_DIGEST("morning_digest", "Good morning %s, here is your day", 0, true),
  LUNCH_REMINDER("lunch_reminder", "Lunch break reminder and afternoon preview", 0, true),
  END_OF_DAY_SUMMARY("end_of_day_summary", "End of day summary and tomorrow's preview", 1, true),
  HOURLY_CHECK("hourly_check", "Your hourly update", 0, false);

  private final String jobName;
  private final String subjectFormat;
  private final int focusDayOffset;
  private final boolean summaryDigest;

  DigestJob(String jobName, String subjectFormat, int focusDayOffset, boolean summaryDigest) {
    this.jobName = jobName;
    this.subjectFormat = subjectFormat;
    this.focusDayOffset = focusDayOffset;
    this.summaryDigest = summaryDigest;
  }

  public String jobName() {
    return jobName;
  }

  public String subjectFor(String displayName) {
    return String.format(subjectFormat, displayName);
  }

  /** 0 looks at today, 1 previews tomorrow. */
  public int focusDayOffset() {
    return focusDayOffset;
  }

  /** Daily digests mail a summary even without non-urgent candidates. */
  public boolean isSummaryDigest() {
    return summaryDigest;
  }

  public boolean isEnabledFor(UserPreferences preferences) {
    return switch (this) {
      case MORNING_DIGEST -> preferences.morningDigest();
      case LUNCH_REMINDER -> preferences.lunchReminder();
      case END_OF_DAY_SUMMARY -> preferences.endOfDaySummary();
      case HOURLY_CHECK -> preferences.taskReminders() || preferences.meetingReminders();
    };
  }

  public String cron(DigestProperties properties) {
    return switch (this) {
      case MORNING_DIGEST -> properties.morningCron();
      case LUNCH_REMINDER -> properties.lunchCron();
      case END_OF_DAY_SUMMARY -> properties.endOfDayCron();
      case HOURLY_CHECK -> properties.hourlyCron();
    };
  }
}
