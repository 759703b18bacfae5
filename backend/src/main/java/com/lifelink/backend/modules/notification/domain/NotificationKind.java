package com.lifelink.backend.modules.notification.domain;

public enum NotificationKind {
    MATCH,
    REQUEST,
    MILESTONE
}
