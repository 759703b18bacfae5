package com.lifelink.backend.modules.user.domain;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Gender {
    MALE("male"),
    FEMALE("female"),
    NOT_SPECIFIED("not specified");

    private final String code;

    Gender(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Optional<Gender> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim();
        return Arrays.stream(values())
                .filter(gender -> gender.code.equalsIgnoreCase(normalized) || gender.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
