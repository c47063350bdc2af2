/*
 * Where: collaboration REST API
 * What: inbox queries and read-state changes for the calling user
 * Why: offline recipients catch up here; the caller is always the authenticated principal
 */
package com.worksync.collaboration.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.worksync.collaboration.model.NotificationRecord;
import com.worksync.collaboration.service.NotificationPage;
import com.worksync.collaboration.service.NotificationService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;
    private final ObjectMapper objectMapper;

    @GetMapping
    public NotificationPageResponse list(
            Authentication authentication,
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "limit", defaultValue = "20") int limit) {
        final NotificationPage result = notificationService.list(authentication.getName(), page, limit);
        return new NotificationPageResponse(
                result.page(),
                result.limit(),
                result.total(),
                result.notifications().stream().map(this::toResponse).toList());
    }

    @GetMapping("/unread-count")
    public UnreadCountResponse unreadCount(Authentication authentication) {
        return new UnreadCountResponse(notificationService.unreadCount(authentication.getName()));
    }

    @PutMapping("/mark-all-read")
    public MarkAllReadResponse markAllRead(Authentication authentication) {
        return new MarkAllReadResponse(notificationService.markAllRead(authentication.getName()));
    }

    @PutMapping("/{id}")
    public NotificationResponse updateReadState(
            Authentication authentication,
            @PathVariable("id") UUID id,
            @Valid @RequestBody ReadStateRequest request) {
        return toResponse(notificationService.updateReadState(id, authentication.getName(), request.read()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(Authentication authentication, @PathVariable("id") UUID id) {
        notificationService.delete(id, authentication.getName());
        return ResponseEntity.noContent().build();
    }

    private NotificationResponse toResponse(NotificationRecord record) {
        try {
            return new NotificationResponse(
                    record.id(),
                    record.userId(),
                    record.type().wireValue(),
                    record.priority().wireValue(),
                    record.title(),
                    record.message(),
                    objectMapper.readTree(record.dataJson()),
                    record.read(),
                    record.readAt(),
                    record.createdAt());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("notification data parse failure id=" + record.id(), ex);
        }
    }
}
