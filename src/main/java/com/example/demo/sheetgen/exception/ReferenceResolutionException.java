package com.example.demo.sheetgen.exception;

/**
 * A cross-section reference (comparison column or source section) that does
 * not resolve against the placements computed so far.
 */
public class ReferenceResolutionException extends ReportGenerationException {

    public ReferenceResolutionException(String code, String description) {
        super(code, description);
    }
}
