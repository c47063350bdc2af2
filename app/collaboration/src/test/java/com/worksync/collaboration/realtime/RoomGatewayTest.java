package com.worksync.collaboration.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.worksync.collaboration.model.UserIdentity;
import com.worksync.collaboration.repository.ProjectAccessRepository;
import com.worksync.collaboration.service.CollaborationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class RoomGatewayTest {

    private ConnectionRegistry registry;
    private ProjectAccessRepository projectAccessRepository;
    private RoomGateway gateway;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        projectAccessRepository = mock(ProjectAccessRepository.class);
        final BroadcastDispatcher dispatcher =
                new BroadcastDispatcher(registry, new CollaborationMetrics(new SimpleMeterRegistry(), registry));
        gateway = new RoomGateway(registry, dispatcher, projectAccessRepository);
    }

    @Test
    void nonMemberJoinIsDeniedAndRoomUnchanged() {
        final RecordingChannel member = connect("c-1", "member");
        final RecordingChannel outsider = connect("c-2", "outsider");
        when(projectAccessRepository.isOwnerOrMember("p-1", "member")).thenReturn(true);
        when(projectAccessRepository.isOwnerOrMember("p-1", "outsider")).thenReturn(false);
        gateway.joinProject("c-1", "p-1");
        final int sizeBefore = registry.reachable("project:p-1").size();

        final JoinOutcome outcome = gateway.joinProject("c-2", "p-1");

        assertThat(outcome).isEqualTo(JoinOutcome.ACCESS_DENIED);
        assertThat(registry.reachable("project:p-1")).hasSize(sizeBefore);
        assertThat(outsider.sent()).containsExactly(OutboundEvent.error(RoomGateway.ACCESS_DENIED_MESSAGE));
        assertThat(member.sentEventNames()).containsExactly(OutboundEvent.JOINED_PROJECT);
    }

    @Test
    void memberJoinAcksAndAnnouncesToOthers() {
        final RecordingChannel first = connect("c-1", "user-1");
        final RecordingChannel second = connect("c-2", "user-2");
        when(projectAccessRepository.isOwnerOrMember("p-1", "user-1")).thenReturn(true);
        when(projectAccessRepository.isOwnerOrMember("p-1", "user-2")).thenReturn(true);
        gateway.joinProject("c-1", "p-1");

        final JoinOutcome outcome = gateway.joinProject("c-2", "p-1");

        assertThat(outcome).isEqualTo(JoinOutcome.JOINED);
        assertThat(second.sentEventNames()).containsExactly(OutboundEvent.JOINED_PROJECT);
        assertThat(first.sentEventNames())
                .containsExactly(OutboundEvent.JOINED_PROJECT, OutboundEvent.USER_JOINED_PROJECT);
        assertThat(first.sent().get(1).data())
                .isEqualTo(new OutboundEvent.ProjectPresence("user-2", "user-2@example.com", "p-1"));
    }

    @Test
    void accessLookupFailureReportsUnavailable() {
        final RecordingChannel channel = connect("c-1", "user-1");
        when(projectAccessRepository.isOwnerOrMember("p-1", "user-1"))
                .thenThrow(new DataAccessResourceFailureException("down"));

        assertThat(gateway.joinProject("c-1", "p-1")).isEqualTo(JoinOutcome.UNAVAILABLE);
        assertThat(channel.sent()).containsExactly(OutboundEvent.error(RoomGateway.JOIN_FAILED_MESSAGE));
        assertThat(registry.isMember("c-1", "project:p-1")).isFalse();
    }

    @Test
    void joiningAnotherUsersRoomIsRejected() {
        final RecordingChannel channel = connect("c-1", "user-1");

        gateway.joinUserRoom("c-1", "user-2");
        gateway.joinUserRoom("c-1", "user-1");

        assertThat(channel.sent())
                .containsExactly(
                        OutboundEvent.error(RoomGateway.USER_ROOM_DENIED_MESSAGE),
                        OutboundEvent.joinedUserRoom("user-1"));
        assertThat(registry.roomsOf("c-1")).containsExactly("user:user-1");
    }

    @Test
    void leaveRemovesMembershipAndAnnouncesToRemainingMembers() {
        final RecordingChannel leaving = connect("c-1", "user-1");
        final RecordingChannel staying = connect("c-2", "user-2");
        when(projectAccessRepository.isOwnerOrMember("p-1", "user-1")).thenReturn(true);
        when(projectAccessRepository.isOwnerOrMember("p-1", "user-2")).thenReturn(true);
        gateway.joinProject("c-2", "p-1");
        gateway.joinProject("c-1", "p-1");

        gateway.leaveProject("c-1", "p-1");

        assertThat(registry.reachable("project:p-1")).extracting(LiveConnection::connectionId).containsExactly("c-2");
        assertThat(registry.roomsOf("c-1")).containsExactly("user:user-1");
        assertThat(staying.sentEventNames())
                .containsExactly(
                        OutboundEvent.JOINED_PROJECT,
                        OutboundEvent.USER_JOINED_PROJECT,
                        OutboundEvent.USER_LEFT_PROJECT);
        assertThat(staying.sent().get(2).data())
                .isEqualTo(new OutboundEvent.ProjectPresence("user-1", "user-1@example.com", "p-1"));
        assertThat(leaving.sentEventNames()).containsExactly(OutboundEvent.JOINED_PROJECT);
    }

    @Test
    void leavingARoomNeverJoinedBroadcastsNothing() {
        final RecordingChannel stranger = connect("c-1", "user-1");
        final RecordingChannel member = connect("c-2", "user-2");
        when(projectAccessRepository.isOwnerOrMember("p-1", "user-2")).thenReturn(true);
        gateway.joinProject("c-2", "p-1");

        gateway.leaveProject("c-1", "p-1");

        assertThat(member.sentEventNames()).containsExactly(OutboundEvent.JOINED_PROJECT);
        assertThat(stranger.sent()).isEmpty();
        assertThat(registry.reachable("project:p-1")).extracting(LiveConnection::connectionId).containsExactly("c-2");
    }

    @Test
    void disconnectAnnouncesLeaveToEachProjectRoom() {
        final RecordingChannel leaving = connect("c-1", "user-1");
        final RecordingChannel staying = connect("c-2", "user-2");
        when(projectAccessRepository.isOwnerOrMember("p-1", "user-1")).thenReturn(true);
        when(projectAccessRepository.isOwnerOrMember("p-1", "user-2")).thenReturn(true);
        gateway.joinProject("c-2", "p-1");
        gateway.joinProject("c-1", "p-1");

        gateway.disconnect("c-1");
        gateway.disconnect("c-1");

        assertThat(staying.sentEventNames())
                .containsExactly(
                        OutboundEvent.JOINED_PROJECT,
                        OutboundEvent.USER_JOINED_PROJECT,
                        OutboundEvent.USER_LEFT_PROJECT);
        assertThat(registry.reachable("project:p-1")).extracting(LiveConnection::connectionId).containsExactly("c-2");
        assertThat(leaving.sentEventNames()).containsExactly(OutboundEvent.JOINED_PROJECT);
    }

    @Test
    void evictRemovesMembershipAndNotifiesBothSides() {
        final RecordingChannel evicted = connect("c-1", "user-1");
        final RecordingChannel other = connect("c-2", "user-2");
        when(projectAccessRepository.isOwnerOrMember("p-1", "user-1")).thenReturn(true);
        when(projectAccessRepository.isOwnerOrMember("p-1", "user-2")).thenReturn(true);
        gateway.joinProject("c-2", "p-1");
        gateway.joinProject("c-1", "p-1");

        gateway.evict("c-1", "p-1");

        assertThat(registry.isMember("c-1", "project:p-1")).isFalse();
        assertThat(evicted.sentEventNames())
                .containsExactly(OutboundEvent.JOINED_PROJECT, OutboundEvent.PROJECT_ACCESS_REVOKED);
        assertThat(other.sentEventNames()).endsWith(OutboundEvent.USER_LEFT_PROJECT);
    }

    @Test
    void taskUpdateRelayReachesWholeRoomIncludingSender() {
        final RecordingChannel sender = connect("c-1", "user-1");
        final RecordingChannel peer = connect("c-2", "user-2");
        when(projectAccessRepository.isOwnerOrMember("p-1", "user-1")).thenReturn(true);
        when(projectAccessRepository.isOwnerOrMember("p-1", "user-2")).thenReturn(true);
        gateway.joinProject("c-1", "p-1");
        gateway.joinProject("c-2", "p-1");

        gateway.relayTaskUpdated("c-1", "p-1", "t-1", JsonNodeFactory.instance.objectNode().put("status", "done"));

        assertThat(sender.sentEventNames()).endsWith(OutboundEvent.TASK_UPDATED);
        assertThat(peer.sentEventNames()).endsWith(OutboundEvent.TASK_UPDATED);
    }

    @Test
    void relayFromUnauthorizedSenderIsRefused() {
        final RecordingChannel sender = connect("c-1", "user-1");
        when(projectAccessRepository.isOwnerOrMember("p-1", "user-1")).thenReturn(false);

        gateway.relayCommentAdded("c-1", "p-1", "t-1", JsonNodeFactory.instance.objectNode());

        assertThat(sender.sent()).containsExactly(OutboundEvent.error(RoomGateway.ACCESS_DENIED_MESSAGE));
    }

    @Test
    void typingIsRelayedToOthersInTheTasksProject() {
        final RecordingChannel typist = connect("c-1", "user-1");
        final RecordingChannel peer = connect("c-2", "user-2");
        when(projectAccessRepository.isOwnerOrMember("p-1", "user-1")).thenReturn(true);
        when(projectAccessRepository.isOwnerOrMember("p-1", "user-2")).thenReturn(true);
        when(projectAccessRepository.findProjectIdForTask("t-1")).thenReturn(Optional.of("p-1"));
        gateway.joinProject("c-1", "p-1");
        gateway.joinProject("c-2", "p-1");

        gateway.relayTyping("c-1", "t-1");

        assertThat(peer.sentEventNames()).endsWith(OutboundEvent.USER_TYPING);
        assertThat(typist.sentEventNames()).doesNotContain(OutboundEvent.USER_TYPING);
    }

    @Test
    void typingOutsideJoinedProjectIsRejected() {
        final RecordingChannel typist = connect("c-1", "user-1");
        when(projectAccessRepository.findProjectIdForTask("t-1")).thenReturn(Optional.of("p-1"));

        gateway.relayTyping("c-1", "t-1");

        assertThat(typist.sent()).containsExactly(OutboundEvent.error(RoomGateway.NOT_IN_PROJECT_MESSAGE));
    }

    @Test
    void viewingUnknownEntityTypeIsRejected() {
        final RecordingChannel viewer = connect("c-1", "user-1");

        gateway.relayViewing("c-1", "x-1", "sprint");

        assertThat(viewer.sent()).containsExactly(OutboundEvent.error(RoomGateway.UNKNOWN_ENTITY_MESSAGE));
    }

    private RecordingChannel connect(String connectionId, String userId) {
        final RecordingChannel channel = new RecordingChannel(connectionId);
        gateway.connect(channel, UserIdentity.of(userId, userId + "@example.com", null));
        return channel;
    }
}
