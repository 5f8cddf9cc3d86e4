package com.oraclex.relay.exception;

import java.util.List;

public class ValidationException extends RuntimeException {
    private final List<String> fields;

    public ValidationException(String message, List<String> fields) {
        super(message);
        this.fields = List.copyOf(fields);
    }

    public List<String> getFields() {
        return fields;
    }
}
