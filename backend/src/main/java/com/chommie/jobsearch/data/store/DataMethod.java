package com.chommie.jobsearch.data.store;

public enum DataMethod {
    GET,
    POST,
    PATCH,
    DELETE
}
