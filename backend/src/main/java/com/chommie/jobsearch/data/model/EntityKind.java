package com.chommie.jobsearch.data.model;

/**
 * Entities owned by the store, with the resource path and cache namespace each one lives under.
 */
public enum EntityKind {
    JOB("jobs"),
    USER("users"),
    APPLICATION("applications");

    private final String resource;

    EntityKind(String resource) {
        this.resource = resource;
    }

    public String resource() {
        return resource;
    }

    public String cacheNamespace() {
        return resource + ":";
    }
}
