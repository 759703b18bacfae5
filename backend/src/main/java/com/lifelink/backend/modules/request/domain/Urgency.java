package com.lifelink.backend.modules.request.domain;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Urgency {
    LOW("low", 0),
    MEDIUM("medium", 5),
    HIGH("high", 15),
    CRITICAL("critical", 25);

    private final String code;
    private final int scoreBonus;

    Urgency(String code, int scoreBonus) {
        this.code = code;
        this.scoreBonus = scoreBonus;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /** Added to a request's match score when ranking requests for a donor. */
    public int getScoreBonus() {
        return scoreBonus;
    }

    public static Optional<Urgency> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim();
        return Arrays.stream(values())
                .filter(value -> value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
