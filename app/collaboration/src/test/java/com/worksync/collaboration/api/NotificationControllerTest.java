package com.worksync.collaboration.api;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.worksync.collaboration.config.SecurityConfig;
import com.worksync.collaboration.model.NotificationPriority;
import com.worksync.collaboration.model.NotificationRecord;
import com.worksync.collaboration.model.NotificationType;
import com.worksync.collaboration.service.AuthenticationFailedException;
import com.worksync.collaboration.service.IdentityResolver;
import com.worksync.collaboration.service.NotificationNotFoundException;
import com.worksync.collaboration.service.NotificationPage;
import com.worksync.collaboration.service.NotificationPersistenceException;
import com.worksync.collaboration.service.NotificationService;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(NotificationController.class)
@AutoConfigureMockMvc
@Import(SecurityConfig.class)
@ActiveProfiles("test")
class NotificationControllerTest {

  private static final UUID ID = UUID.fromString("5b7f2a4e-3c1d-4e8f-9a0b-1c2d3e4f5a6b");
  private static final Instant CREATED_AT = Instant.parse("2026-03-10T10:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private NotificationService notificationService;
  @MockitoBean private IdentityResolver identityResolver;

  @Test
  void listRequiresAuthentication() throws Exception {
    mockMvc.perform(get("/notifications")).andExpect(status().isUnauthorized());
  }

  @Test
  void invalidBearerTokenIsRejected() throws Exception {
    when(identityResolver.resolveAuthorizationHeader(anyString()))
        .thenThrow(
            new AuthenticationFailedException(
                AuthenticationFailedException.Reason.INVALID_TOKEN, "token rejected"));

    mockMvc
        .perform(get("/notifications").header("Authorization", "Bearer nope"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void listReturnsCallersPageInSnakeCase() throws Exception {
    when(notificationService.list("user-1", 1, 20))
        .thenReturn(new NotificationPage(1, 20, 1, List.of(record(false))));

    mockMvc
        .perform(get("/notifications").with(user("user-1")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(1))
        .andExpect(jsonPath("$.notifications[0].id").value(ID.toString()))
        .andExpect(jsonPath("$.notifications[0].user_id").value("user-1"))
        .andExpect(jsonPath("$.notifications[0].type").value("task_assigned"))
        .andExpect(jsonPath("$.notifications[0].data.taskId").value("task-1"))
        .andExpect(jsonPath("$.notifications[0].read").value(false));
  }

  @Test
  void outOfRangeLimitIsBadRequest() throws Exception {
    when(notificationService.list("user-1", 1, 500))
        .thenThrow(new IllegalArgumentException("limit must be between 1 and 100"));

    mockMvc
        .perform(get("/notifications").param("limit", "500").with(user("user-1")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void unreadCountIsScopedToCaller() throws Exception {
    when(notificationService.unreadCount("user-1")).thenReturn(3L);

    mockMvc
        .perform(get("/notifications/unread-count").with(user("user-1")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(3));
  }

  @Test
  void markReadReturnsUpdatedNotification() throws Exception {
    when(notificationService.updateReadState(ID, "user-1", true)).thenReturn(record(true));

    mockMvc
        .perform(
            put("/notifications/" + ID)
                .with(user("user-1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"read\":true}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.read").value(true));
  }

  @Test
  void markReadOfForeignNotificationIsNotFound() throws Exception {
    when(notificationService.updateReadState(ID, "user-2", true))
        .thenThrow(new NotificationNotFoundException(ID));

    mockMvc
        .perform(
            put("/notifications/" + ID)
                .with(user("user-2"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"read\":true}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_NOT_FOUND"));
  }

  @Test
  void markReadWithoutBodyFieldIsBadRequest() throws Exception {
    mockMvc
        .perform(
            put("/notifications/" + ID)
                .with(user("user-1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void malformedIdIsBadRequest() throws Exception {
    mockMvc
        .perform(delete("/notifications/not-a-uuid").with(user("user-1")))
        .andExpect(status().isBadRequest());
  }

  @Test
  void markAllReadReportsUpdatedCount() throws Exception {
    when(notificationService.markAllRead("user-1")).thenReturn(4);

    mockMvc
        .perform(put("/notifications/mark-all-read").with(user("user-1")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.updated").value(4));
  }

  @Test
  void deleteAnswersNoContent() throws Exception {
    mockMvc
        .perform(delete("/notifications/" + ID).with(user("user-1")))
        .andExpect(status().isNoContent());

    verify(notificationService).delete(ID, "user-1");
  }

  @Test
  void storeOutageIsServiceUnavailable() throws Exception {
    doThrow(new NotificationPersistenceException("down", new RuntimeException()))
        .when(notificationService)
        .delete(ID, "user-1");

    mockMvc
        .perform(delete("/notifications/" + ID).with(user("user-1")))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("PERSISTENCE_FAILURE"));
  }

  private static NotificationRecord record(boolean read) {
    return new NotificationRecord(
        ID,
        "user-1",
        NotificationType.TASK_ASSIGNED,
        "New Task Assigned",
        "Alice assigned you a task: Write report",
        NotificationPriority.MEDIUM,
        "{\"taskId\":\"task-1\",\"taskTitle\":\"Write report\",\"assignedBy\":\"Alice\"}",
        read,
        read ? CREATED_AT : null,
        CREATED_AT);
  }
}
