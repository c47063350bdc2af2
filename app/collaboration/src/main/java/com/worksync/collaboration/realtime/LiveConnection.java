package com.worksync.collaboration.realtime;

import com.worksync.collaboration.model.UserIdentity;

/** A registered connection: who is behind it and how to reach it. Lives only in this process. */
public record LiveConnection(String connectionId, UserIdentity identity, ConnectionChannel channel) {

  public static LiveConnection of(ConnectionChannel channel, UserIdentity identity) {
    return new LiveConnection(channel.id(), identity, channel);
  }

  public String userId() {
    return identity.userId();
  }

  public String displayName() {
    return identity.displayName();
  }
}
