package com.worksync.collaboration.model;

public record UserPreferences(
    boolean morningDigest,
    boolean lunchReminder,
    boolean endOfDaySummary,
    boolean meetingReminders,
    boolean taskReminders,
    boolean urgentOnly) {

  /** Applied when the user never saved preferences. */
  public static UserPreferences defaults() {
    return new UserPreferences(true, true, true, true, true, false);
  }
}
