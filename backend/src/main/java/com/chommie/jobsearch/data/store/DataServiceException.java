package com.chommie.jobsearch.data.store;

public abstract class DataServiceException extends RuntimeException {
    private final String resourcePath;

    protected DataServiceException(String resourcePath, String message, Throwable cause) {
        super(message, cause);
        this.resourcePath = resourcePath;
    }

    public String getResourcePath() {
        return resourcePath;
    }

    public abstract boolean isTransient();
}
