package com.chommie.jobsearch.data.persistence;

import com.chommie.jobsearch.config.JobSearchProperties;
import com.chommie.jobsearch.data.store.DataMethod;
import com.chommie.jobsearch.data.store.DataResult;
import com.chommie.jobsearch.data.store.DataServiceClient;
import com.chommie.jobsearch.data.store.PermanentDataServiceException;
import com.chommie.jobsearch.data.store.RequestParams;
import com.chommie.jobsearch.data.store.TransientDataServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Sends store requests for the repositories, retrying transient failures with jittered
 * exponential backoff.
 */
@Component
public class StoreRequestExecutor {
    private static final Logger log = LoggerFactory.getLogger(StoreRequestExecutor.class);

    private final DataServiceClient client;
    private final JobSearchProperties properties;

    public StoreRequestExecutor(DataServiceClient client, JobSearchProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    public DataResult execute(DataMethod method, String resourcePath, RequestParams params) {
        int maxAttempts = 1 + properties.getStore().getMaxRetries();
        TransientDataServiceException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return client.request(method, resourcePath, params);
            } catch (TransientDataServiceException e) {
                last = e;
                if (attempt >= maxAttempts) {
                    break;
                }
                log.warn("Transient failure on {} {} (attempt {}/{}): {}", method, resourcePath, attempt, maxAttempts, e.getMessage());
                if (!sleepBackoff(attempt)) {
                    break;
                }
            } catch (PermanentDataServiceException e) {
                if (e.isConflict()) {
                    log.debug("Conflict on {} {}: {}", method, resourcePath, e.getMessage());
                } else {
                    log.warn("Permanent failure on {} {}: {}", method, resourcePath, e.getMessage());
                }
                throw e;
            }
        }
        log.warn("Giving up on {} {} after {} attempts", method, resourcePath, maxAttempts);
        throw new StoreUnavailableException(resourcePath, last);
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getStore().getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getStore().getRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
