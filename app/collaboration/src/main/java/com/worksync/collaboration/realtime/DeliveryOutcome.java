package com.worksync.collaboration.realtime;

/**
 * Result of one fan-out. {@code attempted} counts connections that were in the room (minus the
 * excluded one); {@code delivered} counts those whose send completed without error.
 */
public record DeliveryOutcome(String roomId, int attempted, int delivered) {

  public static DeliveryOutcome empty(String roomId) {
    return new DeliveryOutcome(roomId, 0, 0);
  }

  public boolean reachedAny() {
    return delivered > 0;
  }

  public int failed() {
    return attempted - delivered;
  }
}
