package com.chommie.jobsearch.data.store;

public class TransientDataServiceException extends DataServiceException {
    public TransientDataServiceException(String resourcePath, String message) {
        this(resourcePath, message, null);
    }

    public TransientDataServiceException(String resourcePath, String message, Throwable cause) {
        super(resourcePath, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
