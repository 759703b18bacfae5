package com.lifelink.backend.modules.user.domain;

public enum UserStatus {
    ACTIVE,
    SUSPENDED
}
