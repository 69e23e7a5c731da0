package com.example.demo.sheetgen.exception;

/**
 * Malformed report template: empty or unparsable document, duplicate sheet
 * names or section ids, missing names, unknown template id.
 */
public class TemplateConfigException extends ReportGenerationException {

    public TemplateConfigException(String code, String description) {
        super(code, description);
    }

    public TemplateConfigException(String code, String description, Throwable cause) {
        super(code, description, cause);
    }
}
