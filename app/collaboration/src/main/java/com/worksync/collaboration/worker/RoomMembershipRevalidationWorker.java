/*
 * Where: realtime maintenance
 * What: re-checks project room members against ownership and membership, evicting revoked users
 * Why: access is checked on join, so a later revocation would otherwise last until disconnect
 */
package com.worksync.collaboration.worker;

import com.worksync.collaboration.realtime.ConnectionRegistry;
import com.worksync.collaboration.realtime.LiveConnection;
import com.worksync.collaboration.realtime.RoomGateway;
import com.worksync.collaboration.realtime.RoomIds;
import com.worksync.collaboration.repository.ProjectAccessRepository;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "collaboration.realtime.revalidation-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class RoomMembershipRevalidationWorker {

  private static final Logger logger =
      LoggerFactory.getLogger(RoomMembershipRevalidationWorker.class);

  private final ConnectionRegistry registry;
  private final RoomGateway gateway;
  private final ProjectAccessRepository projectAccessRepository;

  @Scheduled(fixedDelayString = "${collaboration.realtime.revalidation-interval}")
  public void run() {
    int evicted = 0;
    for (Map.Entry<String, List<LiveConnection>> room : registry.projectRoomMembers().entrySet()) {
      final String projectId = RoomIds.projectIdOf(room.getKey());
      try {
        evicted += revalidate(projectId, room.getValue());
      } catch (DataAccessException ex) {
        logger.warn("room revalidation skipped projectId={}", projectId, ex);
      }
    }
    if (evicted > 0) {
      logger.info("room revalidation evicted connections={}", evicted);
    }
  }

  private int revalidate(String projectId, List<LiveConnection> members) {
    // one lookup per user even when the user has several tabs open
    final Map<String, Boolean> allowed = new HashMap<>();
    int evicted = 0;
    for (LiveConnection connection : members) {
      final boolean stillAllowed =
          allowed.computeIfAbsent(
              connection.userId(),
              userId -> projectAccessRepository.isOwnerOrMember(projectId, userId));
      if (!stillAllowed) {
        gateway.evict(connection.connectionId(), projectId);
        evicted++;
      }
    }
    return evicted;
  }
}
