package com.threatflow.assembler.model;

/**
 * Error descriptor carried by a record, e.g. {@code {"error":{"code":"...","message":"..."}}}.
 */
public final class RecordError {
    public final String code;
    public final String message;
    public final String details;

    public RecordError(String code, String message, String details) {
        this.code = code;
        this.message = message;
        this.details = details;
    }

    @Override
    public String toString() {
        return "RecordError{code=" + code + ", message=" + message + "}";
    }
}
