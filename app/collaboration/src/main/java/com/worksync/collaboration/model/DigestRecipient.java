package com.worksync.collaboration.model;

public record DigestRecipient(
    String userId, String email, String fullName, UserPreferences preferences) {

  public String displayName() {
    if (fullName != null && !fullName.isBlank()) {
      return fullName;
    }
    return UserIdentity.emailLocalPart(email);
  }
}
