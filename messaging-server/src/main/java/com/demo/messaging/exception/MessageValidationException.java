package com.demo.messaging.exception;

import com.demo.messaging.domain.ValidationResult;

import java.util.List;

public class MessageValidationException extends MessagingException {

    private final transient ValidationResult result;

    public MessageValidationException(ValidationResult result) {
        super("Invalid message: " + result.getErrorMessage());
        this.result = result;
    }

    public List<String> getErrors() {
        return result.getErrors();
    }
}
