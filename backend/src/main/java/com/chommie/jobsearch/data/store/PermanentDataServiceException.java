package com.chommie.jobsearch.data.store;

public class PermanentDataServiceException extends DataServiceException {
    private final boolean conflict;

    public PermanentDataServiceException(String resourcePath, String message) {
        this(resourcePath, message, false, null);
    }

    public PermanentDataServiceException(String resourcePath, String message, boolean conflict, Throwable cause) {
        super(resourcePath, message, cause);
        this.conflict = conflict;
    }

    /**
     * True when the store rejected the write because of a uniqueness constraint.
     */
    public boolean isConflict() {
        return conflict;
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
