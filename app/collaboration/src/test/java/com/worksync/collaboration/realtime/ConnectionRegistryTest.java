package com.worksync.collaboration.realtime;

import static org.assertj.core.api.Assertions.assertThat;

import com.worksync.collaboration.model.UserIdentity;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ConnectionRegistryTest {

  private final ConnectionRegistry registry = new ConnectionRegistry();

  @Test
  void registerPlacesConnectionInItsUserRoomOnly() {
    final LiveConnection connection = connection("c-1", "user-1");

    registry.register(connection);

    assertThat(registry.roomsOf("c-1")).containsExactly("user:user-1");
    assertThat(registry.reachable("user:user-1")).containsExactly(connection);
    assertThat(registry.connectionCount()).isEqualTo(1);
  }

  @Test
  void twoTabsOfOneUserShareTheUserRoom() {
    registry.register(connection("c-1", "user-1"));
    registry.register(connection("c-2", "user-1"));

    assertThat(registry.reachable("user:user-1"))
        .extracting(LiveConnection::connectionId)
        .containsExactlyInAnyOrder("c-1", "c-2");
  }

  @Test
  void addToRoomFailsForUnknownConnection() {
    assertThat(registry.addToRoom("missing", "project:p-1")).isFalse();
    assertThat(registry.reachable("project:p-1")).isEmpty();
  }

  @Test
  void removeFromRoomKeepsOtherMemberships() {
    registry.register(connection("c-1", "user-1"));
    registry.addToRoom("c-1", "project:p-1");
    registry.addToRoom("c-1", "project:p-2");

    registry.removeFromRoom("c-1", "project:p-1");

    assertThat(registry.roomsOf("c-1")).containsExactlyInAnyOrder("user:user-1", "project:p-2");
    assertThat(registry.reachable("project:p-1")).isEmpty();
    assertThat(registry.isMember("c-1", "project:p-2")).isTrue();
  }

  @Test
  void unregisterRemovesEveryMembershipAndReturnsProjectRooms() {
    registry.register(connection("c-1", "user-1"));
    registry.addToRoom("c-1", "project:p-1");
    registry.addToRoom("c-1", "project:p-2");

    final List<String> projectRooms = registry.unregister("c-1");

    assertThat(projectRooms).containsExactlyInAnyOrder("project:p-1", "project:p-2");
    assertThat(registry.reachable("user:user-1")).isEmpty();
    assertThat(registry.reachable("project:p-1")).isEmpty();
    assertThat(registry.roomsOf("c-1")).isEmpty();
    assertThat(registry.connectionCount()).isZero();
  }

  @Test
  void unregisterIsIdempotent() {
    registry.register(connection("c-1", "user-1"));
    registry.addToRoom("c-1", "project:p-1");

    registry.unregister("c-1");

    assertThat(registry.unregister("c-1")).isEmpty();
  }

  @Test
  void projectRoomMembersListsOnlyProjectRooms() {
    registry.register(connection("c-1", "user-1"));
    registry.register(connection("c-2", "user-2"));
    registry.addToRoom("c-1", "project:p-1");
    registry.addToRoom("c-2", "project:p-1");

    assertThat(registry.projectRoomMembers()).containsOnlyKeys("project:p-1");
    assertThat(registry.projectRoomMembers().get("project:p-1")).hasSize(2);
  }

  @Test
  void concurrentJoinsAndDisconnectsLeaveNoDanglingMembership() throws Exception {
    final int connections = 64;
    for (int i = 0; i < connections; i++) {
      registry.register(connection("c-" + i, "user-" + i));
    }
    final ExecutorService pool = Executors.newFixedThreadPool(8);
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<?>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < connections; i++) {
        final String connectionId = "c-" + i;
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  for (int round = 0; round < 50; round++) {
                    registry.addToRoom(connectionId, "project:shared");
                    registry.removeFromRoom(connectionId, "project:shared");
                    registry.addToRoom(connectionId, "project:shared");
                  }
                  return null;
                }));
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  registry.unregister(connectionId);
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(registry.connectionCount()).isZero();
    assertThat(registry.reachable("project:shared")).isEmpty();
    assertThat(registry.projectRoomMembers()).isEmpty();
  }

  private static LiveConnection connection(String connectionId, String userId) {
    return LiveConnection.of(
        new RecordingChannel(connectionId),
        UserIdentity.of(userId, userId + "@example.com", "User " + userId));
  }
}
