package com.worksync.collaboration.model;

/** Authenticated principal behind a connection or an API request. */
public record UserIdentity(String userId, String email, String displayName) {

  public static UserIdentity of(String userId, String email, String name) {
    final String displayName = name == null || name.isBlank() ? emailLocalPart(email) : name;
    return new UserIdentity(userId, email, displayName);
  }

  static String emailLocalPart(String email) {
    if (email == null) {
      return "";
    }
    final int at = email.indexOf('@');
    return at < 0 ? email : email.substring(0, at);
  }
}
