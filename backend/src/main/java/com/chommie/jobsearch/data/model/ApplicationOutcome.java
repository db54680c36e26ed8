package com.chommie.jobsearch.data.model;

import com.chommie.jobsearch.data.validation.FieldError;

import java.util.List;

public record ApplicationOutcome(boolean success, Application application, String error, List<FieldError> fieldErrors) {
    public static ApplicationOutcome submitted(Application application) {
        return new ApplicationOutcome(true, application, null, List.of());
    }

    public static ApplicationOutcome failed(String error, List<FieldError> fieldErrors) {
        return new ApplicationOutcome(false, null, error, fieldErrors == null ? List.of() : List.copyOf(fieldErrors));
    }
}
