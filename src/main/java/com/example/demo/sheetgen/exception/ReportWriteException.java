package com.example.demo.sheetgen.exception;

/**
 * Wraps I/O failures of the destination stream or file.
 */
public class ReportWriteException extends ReportGenerationException {

    public ReportWriteException(String code, String description, Throwable cause) {
        super(code, description, cause);
    }
}
