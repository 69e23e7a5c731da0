package com.example.demo.sheetgen.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SectionDirection {
    VERTICAL("vertical"),
    HORIZONTAL("horizontal");

    private final String value;

    SectionDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SectionDirection fromValue(String value) {
        if (value == null || value.isBlank()) {
            return VERTICAL;
        }
        String normalized = value.trim().toLowerCase();
        for (SectionDirection direction : values()) {
            if (direction.value.equals(normalized)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown section direction: " + value);
    }
}
