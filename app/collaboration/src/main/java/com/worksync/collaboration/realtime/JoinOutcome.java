package com.worksync.collaboration.realtime;

public enum JoinOutcome {
  JOINED,
  ACCESS_DENIED,
  /** The authorization lookup itself failed; membership is left unchanged. */
  UNAVAILABLE
}
