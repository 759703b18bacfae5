package com.lifelink.backend.modules.notification.application;

public record Achievement(String id, String type, String title, String message, int points) {
}
