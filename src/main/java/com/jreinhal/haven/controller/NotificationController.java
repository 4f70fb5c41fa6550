package com.jreinhal.haven.controller;

import com.jreinhal.haven.filter.SecurityContext;
import com.jreinhal.haven.model.Notification;
import com.jreinhal.haven.service.NotificationService;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbox of the calling identity. Any authenticated caller; no permission required.
 */
@RestController
@RequestMapping(value = {"/api/notifications"})
@Tag(name = "Notifications")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public List<Notification> list(@RequestParam(value = "unreadOnly", defaultValue = "false") boolean unreadOnly) {
        return notificationService.list(SecurityContext.requireClaims().subjectId(), unreadOnly);
    }

    @GetMapping(value = {"/unread-count"})
    public Map<String, Long> unreadCount() {
        return Map.of("count", notificationService.unreadCount(SecurityContext.requireClaims().subjectId()));
    }

    @PatchMapping(value = {"/{id}/read"})
    public Notification markRead(@PathVariable String id) {
        return notificationService.markRead(id, SecurityContext.requireClaims().subjectId());
    }

    @PatchMapping(value = {"/mark-all-read"})
    public Map<String, Integer> markAllRead() {
        return Map.of("updated", notificationService.markAllRead(SecurityContext.requireClaims().subjectId()));
    }

    @DeleteMapping(value = {"/{id}"})
    public ResponseEntity<Void> delete(@PathVariable String id) {
        notificationService.delete(id, SecurityContext.requireClaims().subjectId());
        return ResponseEntity.noContent().build();
    }
}
