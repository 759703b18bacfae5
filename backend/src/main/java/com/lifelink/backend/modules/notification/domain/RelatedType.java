package com.lifelink.backend.modules.notification.domain;

public enum RelatedType {
    REQUEST,
    DONATION,
    USER,
    ACHIEVEMENT
}
