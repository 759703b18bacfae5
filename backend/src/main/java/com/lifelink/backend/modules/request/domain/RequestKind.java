package com.lifelink.backend.modules.request.domain;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RequestKind {
    BLOOD("blood"),
    ORGAN("organ");

    private final String code;

    RequestKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Optional<RequestKind> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim();
        return Arrays.stream(values())
                .filter(value -> value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
