package com.lifelink.backend.modules.request.domain;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OrganType {
    KIDNEY("kidney"),
    LIVER("liver"),
    HEART("heart"),
    LUNG("lung"),
    PANCREAS("pancreas"),
    CORNEA("cornea");

    private final String code;

    OrganType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Optional<OrganType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim();
        return Arrays.stream(values())
                .filter(value -> value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
