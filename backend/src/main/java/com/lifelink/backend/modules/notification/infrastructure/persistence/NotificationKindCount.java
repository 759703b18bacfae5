package com.lifelink.backend.modules.notification.infrastructure.persistence;

import com.lifelink.backend.modules.notification.domain.NotificationKind;

public record NotificationKindCount(NotificationKind kind, long count) {
}
