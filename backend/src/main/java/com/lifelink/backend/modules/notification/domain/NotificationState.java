package com.lifelink.backend.modules.notification.domain;

public enum NotificationState {
    UNREAD,
    READ
}
