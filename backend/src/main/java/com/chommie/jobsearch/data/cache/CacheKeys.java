package com.chommie.jobsearch.data.cache;

import com.chommie.jobsearch.data.util.HashUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Builds keys of the form {@code entity:operation:sha256(params)}. Parameters are
 * serialized with sorted properties and map keys, so equal parameter sets give equal keys.
 */
public final class CacheKeys {
    public static final String BY_ID = "by-id";
    public static final String SEARCH = "search";
    public static final String TRENDING = "trending";
    public static final String SIMILAR = "similar";
    public static final String HAS_APPLIED = "has-applied";

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .build();

    private CacheKeys() {
    }

    public static String key(String entity, String operation, Object params) {
        return namespace(entity, operation) + hash(params);
    }

    public static String namespace(String entity, String operation) {
        return entity + ":" + operation + ":";
    }

    static String hash(Object params) {
        try {
            return HashUtils.sha256Hex(CANONICAL.writeValueAsString(params));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache key parameters are not serializable", e);
        }
    }
}
