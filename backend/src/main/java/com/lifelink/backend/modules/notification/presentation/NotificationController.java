package com.lifelink.backend.modules.notification.presentation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.lifelink.backend.global.error.ProblemException;
import com.lifelink.backend.global.security.SecurityUtils;
import com.lifelink.backend.global.web.PageRequests;
import com.lifelink.backend.modules.notification.application.NotificationService;
import com.lifelink.backend.modules.notification.application.NotificationService.NotificationPageResult;
import com.lifelink.backend.modules.notification.application.NotificationService.NotificationStats;
import com.lifelink.backend.modules.notification.domain.Notification;
import com.lifelink.backend.modules.notification.domain.NotificationKind;
import com.lifelink.backend.modules.notification.domain.NotificationState;
import com.lifelink.backend.modules.notification.presentation.dto.NotificationItemResponse;
import com.lifelink.backend.modules.notification.presentation.dto.NotificationListResponse;
import com.lifelink.backend.modules.notification.presentation.dto.NotificationStatsResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public ResponseEntity<NotificationListResponse> getNotifications(
            @RequestParam(name = "state", defaultValue = "all") String stateParam,
            @RequestParam(name = "kind", required = false) String kindParam,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        UUID userId = SecurityUtils.getCurrentUserId();
        NotificationPageResult result = notificationService.getNotifications(
                userId,
                parseState(stateParam),
                parseKind(kindParam),
                PageRequests.of(page, size)
        );

        List<NotificationItemResponse> items = result.notifications().stream()
                .map(this::toItemResponse)
                .toList();

        return ResponseEntity.ok(new NotificationListResponse(
                items,
                result.page(),
                result.size(),
                result.totalElements(),
                result.unreadCount()
        ));
    }

    @PatchMapping("/{notificationId}/read")
    public ResponseEntity<NotificationItemResponse> markRead(@PathVariable("notificationId") UUID notificationId) {
        UUID userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(toItemResponse(notificationService.markNotificationRead(userId, notificationId)));
    }

    @PostMapping("/read-all")
    public ResponseEntity<Map<String, Integer>> markAllRead() {
        UUID userId = SecurityUtils.getCurrentUserId();
        int updated = notificationService.markAllNotificationsRead(userId);
        return ResponseEntity.ok(Map.of("updated", updated));
    }

    @DeleteMapping("/{notificationId}")
    public ResponseEntity<Void> delete(@PathVariable("notificationId") UUID notificationId) {
        UUID userId = SecurityUtils.getCurrentUserId();
        notificationService.deleteNotification(userId, notificationId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Integer>> deleteAll() {
        UUID userId = SecurityUtils.getCurrentUserId();
        int deleted = notificationService.deleteAllNotifications(userId);
        return ResponseEntity.ok(Map.of("deleted", deleted));
    }

    @GetMapping("/stats")
    public ResponseEntity<NotificationStatsResponse> getStats() {
        UUID userId = SecurityUtils.getCurrentUserId();
        NotificationStats stats = notificationService.getStats(userId);
        Map<String, Long> byKind = new LinkedHashMap<>();
        stats.byKind().forEach((kind, count) -> byKind.put(kind.name().toLowerCase(Locale.ROOT), count));
        return ResponseEntity.ok(new NotificationStatsResponse(stats.total(), stats.unread(), stats.read(), byKind));
    }

    private NotificationItemResponse toItemResponse(Notification notification) {
        return new NotificationItemResponse(
                notification.getId(),
                notification.getKind().name().toLowerCase(Locale.ROOT),
                notification.getTitle(),
                notification.getBody(),
                notification.getState().name(),
                notification.getRelatedId(),
                notification.getRelatedType() != null ? notification.getRelatedType().name() : null,
                notification.getMetadata(),
                notification.getCreatedAt(),
                notification.getReadAt()
        );
    }

    private NotificationState parseState(String value) {
        String normalized = value == null ? "all" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "all" -> null;
            case "unread" -> NotificationState.UNREAD;
            case "read" -> NotificationState.READ;
            default -> throw ProblemException.badRequest("INVALID_STATE", "State must be all, unread or read");
        };
    }

    private NotificationKind parseKind(String value) {
        if (value == null) {
            return null;
        }
        try {
            return NotificationKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw ProblemException.badRequest("INVALID_KIND", "Kind must be match, request or milestone");
        }
    }
}
