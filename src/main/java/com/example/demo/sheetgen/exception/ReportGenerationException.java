package com.example.demo.sheetgen.exception;

import lombok.Getter;

/**
 * Base type for every failure raised by the report engine.
 * Carries a stable machine-readable code next to the human description so
 * outer layers can map failures without parsing messages.
 */
@Getter
public class ReportGenerationException extends RuntimeException {
    private final String code;
    private final String description;

    public ReportGenerationException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public ReportGenerationException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }
}
