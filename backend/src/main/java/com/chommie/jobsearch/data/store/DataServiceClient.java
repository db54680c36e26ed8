package com.chommie.jobsearch.data.store;

/**
 * The single request primitive through which the core reaches the backing store.
 * Implementations must honor a request timeout and report it as a transient failure.
 */
public interface DataServiceClient {

    /**
     * @throws TransientDataServiceException on timeouts, connection failures and overload
     * @throws PermanentDataServiceException on malformed requests and constraint violations
     */
    DataResult request(DataMethod method, String resourcePath, RequestParams params);
}
