/*
 * Where: realtime layer
 * What: fans an event out to every live connection of a room, optionally excluding the sender
 * Why: pushes are best effort; a dead socket must never fail the caller
 */
package com.worksync.collaboration.realtime;

import com.worksync.collaboration.service.CollaborationMetrics;
import java.io.IOException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BroadcastDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(BroadcastDispatcher.class);

    private final ConnectionRegistry registry;
    private final CollaborationMetrics metrics;

    public DeliveryOutcome deliverToUser(String userId, OutboundEvent event) {
        return deliverToRoom(RoomIds.user(userId), event, null);
    }

    /**
     * Sends to the room's current members. No retry and no queueing: a member that is closed or
     * whose send fails is counted and skipped.
     */
    public DeliveryOutcome deliverToRoom(String roomId, OutboundEvent event, @Nullable String excludeConnectionId) {
        final List<LiveConnection> targets = registry.reachable(roomId);
        int attempted = 0;
        int delivered = 0;
        for (LiveConnection target : targets) {
            if (target.connectionId().equals(excludeConnectionId)) {
                continue;
            }
            attempted++;
            if (sendQuietly(target, event)) {
                delivered++;
            }
        }
        if (attempted == 0) {
            metrics.recordDelivery("unreachable", 1);
            logger.debug("no live connection for room={} event={}", roomId, event.event());
            return DeliveryOutcome.empty(roomId);
        }
        metrics.recordDelivery("delivered", delivered);
        metrics.recordDelivery("failed", attempted - delivered);
        return new DeliveryOutcome(roomId, attempted, delivered);
    }

    /** Sends to one connection, used for acknowledgements and errors. */
    public boolean deliverToConnection(LiveConnection target, OutboundEvent event) {
        final boolean sent = sendQuietly(target, event);
        metrics.recordDelivery(sent ? "delivered" : "failed", 1);
        return sent;
    }

    private boolean sendQuietly(LiveConnection target, OutboundEvent event) {
        if (!target.channel().isOpen()) {
            logger.debug("skip closed connection connectionId={} event={}", target.connectionId(), event.event());
            return false;
        }
        try {
            target.channel().send(event);
            return true;
        } catch (IOException | RuntimeException ex) {
            logger.warn("event delivery failed connectionId={} userId={} event={}",
                    target.connectionId(),
                    target.userId(),
                    event.event(),
                    ex);
            return false;
        }
    }
}
