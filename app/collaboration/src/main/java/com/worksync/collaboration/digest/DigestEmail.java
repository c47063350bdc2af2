package com.worksync.collaboration.digest;

public record DigestEmail(String to, String subject, String htmlBody, String textBody) {}
