/*
 * Where: realtime layer
 * What: room joins and leaves, presence announcements and collaboration relays for live connections
 * Why: every project-room mutation and fan-out passes an authorization check first
 */
package com.worksync.collaboration.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.worksync.collaboration.model.UserIdentity;
import com.worksync.collaboration.repository.ProjectAccessRepository;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RoomGateway {

    private static final Logger logger = LoggerFactory.getLogger(RoomGateway.class);

    static final String ACCESS_DENIED_MESSAGE = "Access denied to project";
    static final String JOIN_FAILED_MESSAGE = "Failed to join project";
    static final String USER_ROOM_DENIED_MESSAGE = "Cannot join another user's room";
    static final String NOT_IN_PROJECT_MESSAGE = "Join the project before sending activity";
    static final String UNKNOWN_ENTITY_MESSAGE = "Unknown entity";

    private final ConnectionRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final ProjectAccessRepository projectAccessRepository;

    /** Registers an authenticated connection; it starts out in its own user room only. */
    public LiveConnection connect(ConnectionChannel channel, UserIdentity identity) {
        final LiveConnection connection = LiveConnection.of(channel, identity);
        registry.register(connection);
        logger.info("connection registered connectionId={} userId={}", connection.connectionId(), identity.userId());
        return connection;
    }

    public void joinUserRoom(String connectionId, String userId) {
        final Optional<LiveConnection> connection = registry.connection(connectionId);
        if (connection.isEmpty()) {
            return;
        }
        if (!connection.get().userId().equals(userId)) {
            logger.warn("user room join rejected connectionId={} userId={} requested={}",
                    connectionId, connection.get().userId(), userId);
            dispatcher.deliverToConnection(connection.get(), OutboundEvent.error(USER_ROOM_DENIED_MESSAGE));
            return;
        }
        dispatcher.deliverToConnection(connection.get(), OutboundEvent.joinedUserRoom(userId));
    }

    public JoinOutcome joinProject(String connectionId, String projectId) {
        final String roomId = RoomIds.project(projectId);
        final Optional<LiveConnection> found = registry.connection(connectionId);
        if (found.isEmpty()) {
            return JoinOutcome.UNAVAILABLE;
        }
        final LiveConnection connection = found.get();
        final boolean authorized;
        try {
            authorized = projectAccessRepository.isOwnerOrMember(projectId, connection.userId());
        } catch (DataAccessException ex) {
            logger.error("project access check failed projectId={} userId={}", projectId, connection.userId(), ex);
            dispatcher.deliverToConnection(connection, OutboundEvent.error(JOIN_FAILED_MESSAGE));
            return JoinOutcome.UNAVAILABLE;
        }
        if (!authorized) {
            logger.info("project join denied projectId={} userId={}", projectId, connection.userId());
            dispatcher.deliverToConnection(connection, OutboundEvent.error(ACCESS_DENIED_MESSAGE));
            return JoinOutcome.ACCESS_DENIED;
        }
        if (!registry.addToRoom(connectionId, roomId)) {
            // disconnected while the lookup was running
            return JoinOutcome.UNAVAILABLE;
        }
        dispatcher.deliverToConnection(connection, OutboundEvent.joinedProject(projectId));
        dispatcher.deliverToRoom(roomId, OutboundEvent.userJoinedProject(connection, projectId), connectionId);
        logger.debug("project joined projectId={} connectionId={}", projectId, connectionId);
        return JoinOutcome.JOINED;
    }

    public void leaveProject(String connectionId, String projectId) {
        final String roomId = RoomIds.project(projectId);
        final Optional<LiveConnection> connection = registry.connection(connectionId);
        if (connection.isEmpty() || !registry.isMember(connectionId, roomId)) {
            return;
        }
        registry.removeFromRoom(connectionId, roomId);
        dispatcher.deliverToRoom(roomId, OutboundEvent.userLeftProject(connection.get(), projectId), null);
    }

    /** Unregisters and tells each project room the connection was in. Safe to call twice. */
    public void disconnect(String connectionId) {
        final Optional<LiveConnection> connection = registry.connection(connectionId);
        final List<String> projectRooms = registry.unregister(connectionId);
        if (connection.isEmpty()) {
            return;
        }
        for (String roomId : projectRooms) {
            dispatcher.deliverToRoom(
                    roomId, OutboundEvent.userLeftProject(connection.get(), RoomIds.projectIdOf(roomId)), null);
        }
        logger.info("connection closed connectionId={} userId={} projectRooms={}",
                connectionId, connection.get().userId(), projectRooms.size());
    }

    /** Removes a connection whose project access was revoked after it joined. */
    public void evict(String connectionId, String projectId) {
        final String roomId = RoomIds.project(projectId);
        final Optional<LiveConnection> connection = registry.connection(connectionId);
        if (connection.isEmpty() || !registry.isMember(connectionId, roomId)) {
            return;
        }
        registry.removeFromRoom(connectionId, roomId);
        dispatcher.deliverToConnection(connection.get(), OutboundEvent.accessRevoked(projectId));
        dispatcher.deliverToRoom(roomId, OutboundEvent.userLeftProject(connection.get(), projectId), null);
        logger.info("connection evicted from project projectId={} connectionId={} userId={}",
                projectId, connectionId, connection.get().userId());
    }

    public void relayTaskUpdated(String connectionId, String projectId, String taskId, JsonNode changes) {
        authorizedSender(connectionId, projectId).ifPresent(sender -> dispatcher.deliverToRoom(
                RoomIds.project(projectId),
                new OutboundEvent(OutboundEvent.TASK_UPDATED,
                        new OutboundEvent.TaskChange(taskId, projectId, changes, sender.userId())),
                null));
    }

    public void relayCommentAdded(String connectionId, String projectId, String taskId, JsonNode comment) {
        authorizedSender(connectionId, projectId).ifPresent(sender -> dispatcher.deliverToRoom(
                RoomIds.project(projectId),
                new OutboundEvent(OutboundEvent.COMMENT_ADDED,
                        new OutboundEvent.CommentChange(taskId, projectId, comment, sender.userId())),
                null));
    }

    public void relayTyping(String connectionId, String taskId) {
        final Optional<LiveConnection> connection = registry.connection(connectionId);
        if (connection.isEmpty()) {
            return;
        }
        final Optional<String> projectId = lookupTaskProject(connection.get(), taskId);
        projectId.flatMap(id -> joinedRoom(connection.get(), id)).ifPresent(roomId -> dispatcher.deliverToRoom(
                roomId,
                new OutboundEvent(OutboundEvent.USER_TYPING,
                        new OutboundEvent.Typing(taskId, connection.get().userId(), connection.get().displayName())),
                connectionId));
    }

    public void relayViewing(String connectionId, String entityId, String entityType) {
        final Optional<LiveConnection> connection = registry.connection(connectionId);
        if (connection.isEmpty()) {
            return;
        }
        final Optional<String> projectId =
                switch (entityType == null ? "" : entityType) {
                    case "project" -> Optional.of(entityId);
                    case "task" -> lookupTaskProject(connection.get(), entityId);
                    default -> {
                        dispatcher.deliverToConnection(connection.get(), OutboundEvent.error(UNKNOWN_ENTITY_MESSAGE));
                        yield Optional.empty();
                    }
                };
        projectId.flatMap(id -> joinedRoom(connection.get(), id)).ifPresent(roomId -> dispatcher.deliverToRoom(
                roomId,
                new OutboundEvent(OutboundEvent.USER_VIEWING,
                        new OutboundEvent.Viewing(
                                entityId, entityType, connection.get().userId(), connection.get().displayName())),
                connectionId));
    }

    private Optional<LiveConnection> authorizedSender(String connectionId, String projectId) {
        final Optional<LiveConnection> connection = registry.connection(connectionId);
        if (connection.isEmpty()) {
            return Optional.empty();
        }
        try {
            if (projectAccessRepository.isOwnerOrMember(projectId, connection.get().userId())) {
                return connection;
            }
        } catch (DataAccessException ex) {
            logger.error("project access check failed projectId={} userId={}",
                    projectId, connection.get().userId(), ex);
        }
        dispatcher.deliverToConnection(connection.get(), OutboundEvent.error(ACCESS_DENIED_MESSAGE));
        return Optional.empty();
    }

    private Optional<String> lookupTaskProject(LiveConnection connection, String taskId) {
        try {
            final Optional<String> projectId = projectAccessRepository.findProjectIdForTask(taskId);
            if (projectId.isEmpty()) {
                dispatcher.deliverToConnection(connection, OutboundEvent.error(UNKNOWN_ENTITY_MESSAGE));
            }
            return projectId;
        } catch (DataAccessException ex) {
            logger.warn("task lookup failed taskId={} userId={}", taskId, connection.userId(), ex);
            return Optional.empty();
        }
    }

    private Optional<String> joinedRoom(LiveConnection connection, String projectId) {
        final String roomId = RoomIds.project(projectId);
        if (registry.isMember(connection.connectionId(), roomId)) {
            return Optional.of(roomId);
        }
        dispatcher.deliverToConnection(connection, OutboundEvent.error(NOT_IN_PROJECT_MESSAGE));
        return Optional.empty();
    }
}
