package com.example.demo.sheetgen.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a section renders.
 */
public enum SectionType {
    /** Title, optional hidden metadata row, optional header and data rows. */
    FULL("full"),
    /** Only the (possibly merged) title cell. */
    TITLE("title"),
    /** Like FULL, but every row is locked and hidden. */
    HIDDEN("hidden");

    private final String value;

    SectionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SectionType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return FULL;
        }
        String normalized = value.trim().toLowerCase();
        if (normalized.equals("title_only") || normalized.equals("title-only")) {
            return TITLE;
        }
        for (SectionType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown section type: " + value);
    }
}
