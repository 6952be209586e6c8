package com.pagewatch.service.command;

public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
