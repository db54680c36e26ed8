package com.chommie.jobsearch.data.model;

public final class ErrorCodes {
    public static final String VALIDATION_FAILED = "validation_failed";
    public static final String EMAIL_TAKEN = "email_taken";
    public static final String INVALID_CREDENTIALS = "invalid_credentials";
    public static final String ACCOUNT_LOCKED = "account_locked";
    public static final String ALREADY_APPLIED = "already_applied";
    public static final String JOB_NOT_FOUND = "job_not_found";
    public static final String APPLICATION_NOT_FOUND = "application_not_found";
    public static final String DUPLICATE_JOB = "duplicate_job";
    public static final String STORE_UNAVAILABLE = "store_unavailable";

    private ErrorCodes() {
    }
}
