package com.lifelink.backend.modules.request.domain;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RequestStatus {
    PENDING("pending"),
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    /** Statuses a donor may still respond to. */
    public static final Set<RequestStatus> OPEN = EnumSet.of(PENDING, IN_PROGRESS);

    private final String code;

    RequestStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isOpen() {
        return OPEN.contains(this);
    }

    public static Optional<RequestStatus> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim();
        return Arrays.stream(values())
                .filter(value -> value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
