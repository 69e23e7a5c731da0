package com.example.demo.sheetgen.exception;

/**
 * Raised when a section's explicit position cannot be turned into coordinates.
 */
public class LayoutException extends ReportGenerationException {

    public LayoutException(String code, String description) {
        super(code, description);
    }
}
