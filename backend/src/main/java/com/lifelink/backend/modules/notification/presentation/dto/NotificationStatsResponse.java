package com.lifelink.backend.modules.notification.presentation.dto;

import java.util.Map;

public record NotificationStatsResponse(
        long total,
        long unread,
        long read,
        Map<String, Long> byKind
) {
}
