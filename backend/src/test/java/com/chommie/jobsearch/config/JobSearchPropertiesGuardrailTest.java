package com.chommie.jobsearch.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JobSearchPropertiesGuardrailTest {

    @Test
    void storeLimitsAreClamped() {
        JobSearchProperties properties = new JobSearchProperties();
        properties.getStore().setBatchCap(0);
        properties.getStore().setMaxSearchLimit(-5);
        properties.getStore().setMaxRetries(-1);
        assertEquals(1, properties.getStore().getBatchCap());
        assertEquals(1, properties.getStore().getMaxSearchLimit());
        assertEquals(0, properties.getStore().getMaxRetries());
    }

    @Test
    void guardDefaultsMatchLoginPolicy() {
        JobSearchProperties properties = new JobSearchProperties();
        assertEquals(5, properties.getGuard().getLogin().getMaxAttempts());
        assertEquals(900, properties.getGuard().getLogin().getWindowSeconds());
    }

    @Test
    void cacheTtlsStayPositive() {
        JobSearchProperties properties = new JobSearchProperties();
        properties.getCache().setEntityTtlSeconds(0);
        assertEquals(1, properties.getCache().getEntityTtlSeconds());
    }
}
