package com.demo.messaging.domain;

import com.demo.messaging.exception.MessageValidationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Outcome of checking a write before anything is persisted.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    private final List<String> errors;

    public static ValidationResult success() {
        return new ValidationResult(List.of());
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(List.copyOf(errors));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public String getErrorMessage() {
        return String.join("; ", errors);
    }

    public void throwIfInvalid() {
        if (!isValid()) {
            throw new MessageValidationException(this);
        }
    }
}
