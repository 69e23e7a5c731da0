package com.example.demo.sheetgen.exception;

/**
 * Data addressed to a section that cannot accept it: unknown id on bind,
 * or a streaming write that is out of order.
 */
public class DataBindingException extends ReportGenerationException {

    public DataBindingException(String code, String description) {
        super(code, description);
    }
}
