package com.lifelink.backend.modules.user.domain;

public enum UserRole {
    DONOR,
    HOSPITAL,
    ADMIN
}
