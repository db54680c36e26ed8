package com.chommie.jobsearch.data.validation;

public record FieldError(String field, String message) {
}
