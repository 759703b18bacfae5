package com.lifelink.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record NotificationItemResponse(
        UUID id,
        String kind,
        String title,
        String body,
        String state,
        String relatedId,
        String relatedType,
        Map<String, Object> metadata,
        OffsetDateTime createdAt,
        OffsetDateTime readAt
) {
}
