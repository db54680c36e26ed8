package com.chommie.jobsearch.data.persistence;

/**
 * Raised once transient store failures have used up their retries. Callers should ask the
 * user to try again.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String resourcePath, Throwable cause) {
        super("Store unavailable for " + resourcePath + ", try again", cause);
    }
}
