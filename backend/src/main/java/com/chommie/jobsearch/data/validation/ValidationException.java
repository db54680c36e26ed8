package com.chommie.jobsearch.data.validation;

import java.util.List;
import java.util.stream.Collectors;

public class ValidationException extends RuntimeException {
    private final List<FieldError> fieldErrors;

    public ValidationException(List<FieldError> fieldErrors) {
        super(describe(fieldErrors));
        this.fieldErrors = List.copyOf(fieldErrors);
    }

    public ValidationException(String field, String message) {
        this(List.of(new FieldError(field, message)));
    }

    public List<FieldError> getFieldErrors() {
        return fieldErrors;
    }

    public boolean hasErrorFor(String field) {
        return fieldErrors.stream().anyMatch(error -> error.field().equals(field));
    }

    private static String describe(List<FieldError> errors) {
        return "Validation failed: " + errors.stream()
            .map(error -> error.field() + " " + error.message())
            .collect(Collectors.joining("; "));
    }
}
