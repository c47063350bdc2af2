/*
 * Where: realtime layer
 * What: in-memory connection and room membership index
 * Why: the dispatcher resolves room targets here and the gateway mutates membership here
 */
package com.worksync.collaboration.realtime;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Membership is stored twice: per connection (which rooms it is in) and per room (which
 * connections it holds). Both sides are immutable sets replaced through {@code compute}, so every
 * mutation of a room is serialized on that room's key and readers always see a complete snapshot.
 *
 * <p>Connection-side updates run first and nest the room-side update inside them. An
 * {@link #unregister} that races with {@link #addToRoom} therefore either sees the new room in the
 * connection's set (and removes it) or makes {@code addToRoom} a no-op.
 */
@Component
public class ConnectionRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

  private final ConcurrentMap<String, Entry> connections = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Set<String>> rooms = new ConcurrentHashMap<>();

  private record Entry(LiveConnection connection, Set<String> rooms) {}

  /** Registers the connection and places it in its user room. Re-registering an id is a no-op. */
  public void register(LiveConnection connection) {
    final String userRoom = RoomIds.user(connection.userId());
    connections.compute(
        connection.connectionId(),
        (id, existing) -> {
          if (existing != null) {
            return existing;
          }
          addMember(userRoom, id);
          return new Entry(connection, Set.of(userRoom));
        });
  }

  /**
   * Adds membership. Returns false when the connection is not registered (e.g. it disconnected
   * while an authorization lookup was in flight).
   */
  public boolean addToRoom(String connectionId, String roomId) {
    final Entry updated =
        connections.computeIfPresent(
            connectionId,
            (id, entry) -> {
              if (entry.rooms().contains(roomId)) {
                return entry;
              }
              addMember(roomId, id);
              return new Entry(entry.connection(), with(entry.rooms(), roomId));
            });
    return updated != null;
  }

  public void removeFromRoom(String connectionId, String roomId) {
    connections.computeIfPresent(
        connectionId,
        (id, entry) -> {
          if (!entry.rooms().contains(roomId)) {
            return entry;
          }
          removeMember(roomId, id);
          return new Entry(entry.connection(), without(entry.rooms(), roomId));
        });
  }

  /**
   * Removes the connection from every room. Idempotent.
   *
   * @return the project rooms the connection was in, empty when it was already gone
   */
  public List<String> unregister(String connectionId) {
    final Entry removed = connections.remove(connectionId);
    if (removed == null) {
      return List.of();
    }
    final List<String> projectRooms = new ArrayList<>();
    for (String roomId : removed.rooms()) {
      removeMember(roomId, connectionId);
      if (RoomIds.isProjectRoom(roomId)) {
        projectRooms.add(roomId);
      }
    }
    logger.debug(
        "connection unregistered connectionId={} userId={} rooms={}",
        connectionId,
        removed.connection().userId(),
        removed.rooms().size());
    return projectRooms;
  }

  /** Snapshot of the live connections currently in the room. */
  public List<LiveConnection> reachable(String roomId) {
    final Set<String> members = rooms.getOrDefault(roomId, Set.of());
    final List<LiveConnection> result = new ArrayList<>(members.size());
    for (String connectionId : members) {
      final Entry entry = connections.get(connectionId);
      if (entry != null) {
        result.add(entry.connection());
      }
    }
    return result;
  }

  public Optional<LiveConnection> connection(String connectionId) {
    return Optional.ofNullable(connections.get(connectionId)).map(Entry::connection);
  }

  public Set<String> roomsOf(String connectionId) {
    final Entry entry = connections.get(connectionId);
    return entry == null ? Set.of() : entry.rooms();
  }

  public boolean isMember(String connectionId, String roomId) {
    return roomsOf(connectionId).contains(roomId);
  }

  /** Project room id to its current members, for periodic access revalidation. */
  public Map<String, List<LiveConnection>> projectRoomMembers() {
    final Map<String, List<LiveConnection>> result = new LinkedHashMap<>();
    for (String roomId : rooms.keySet()) {
      if (RoomIds.isProjectRoom(roomId)) {
        final List<LiveConnection> members = reachable(roomId);
        if (!members.isEmpty()) {
          result.put(roomId, members);
        }
      }
    }
    return result;
  }

  public int connectionCount() {
    return connections.size();
  }

  private void addMember(String roomId, String connectionId) {
    rooms.compute(roomId, (id, members) -> members == null ? Set.of(connectionId) : with(members, connectionId));
  }

  private void removeMember(String roomId, String connectionId) {
    rooms.computeIfPresent(
        roomId,
        (id, members) -> {
          final Set<String> remaining = without(members, connectionId);
          // drop empty rooms so the map does not grow with every project ever visited
          return remaining.isEmpty() ? null : remaining;
        });
  }

  private static Set<String> with(Set<String> source, String value) {
    final Set<String> copy = new HashSet<>(source);
    copy.add(value);
    return Set.copyOf(copy);
  }

  private static Set<String> without(Set<String> source, String value) {
    final Set<String> copy = new HashSet<>(source);
    copy.remove(value);
    return Set.copyOf(copy);
  }
}
