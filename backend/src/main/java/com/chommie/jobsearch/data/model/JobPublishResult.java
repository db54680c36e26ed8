package com.chommie.jobsearch.data.model;

import com.chommie.jobsearch.data.validation.FieldError;

import java.util.List;

public record JobPublishResult(boolean success, Job job, String error, List<FieldError> fieldErrors) {
    public static JobPublishResult published(Job job) {
        return new JobPublishResult(true, job, null, List.of());
    }

    public static JobPublishResult failed(String error, List<FieldError> fieldErrors) {
        return new JobPublishResult(false, null, error, fieldErrors == null ? List.of() : List.copyOf(fieldErrors));
    }
}
