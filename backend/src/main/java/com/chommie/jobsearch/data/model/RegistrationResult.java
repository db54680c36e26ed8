package com.chommie.jobsearch.data.model;

import com.chommie.jobsearch.data.validation.FieldError;

import java.util.List;

public record RegistrationResult(boolean success, String userId, String error, List<FieldError> fieldErrors) {
    public static RegistrationResult registered(String userId) {
        return new RegistrationResult(true, userId, null, List.of());
    }

    public static RegistrationResult failed(String error, List<FieldError> fieldErrors) {
        return new RegistrationResult(false, null, error, fieldErrors == null ? List.of() : List.copyOf(fieldErrors));
    }
}
