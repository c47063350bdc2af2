package com.worksync.collaboration.digest;

/** What happened for one user during a firing. */
public record UserDigestResult(
    String userId, int candidates, int urgentPushed, int urgentMailed, boolean digestSent) {}
