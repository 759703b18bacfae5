package com.lifelink.backend.modules.donation.domain;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * pending is the only initial state; completed and cancelled are terminal.
 */
public enum DonationStatus {
    PENDING("pending"),
    SCHEDULED("scheduled"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String code;

    DonationStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public static Optional<DonationStatus> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim();
        return Arrays.stream(values())
                .filter(value -> value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
