package com.chommie.jobsearch.data.store;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resources and columns the core is allowed to address. Identifiers cannot be bound as
 * parameters, so every binding checks them here before they reach a request.
 */
public final class ResourceSchema {
    public static final String JOBS = "jobs";
    public static final String USERS = "users";
    public static final String APPLICATIONS = "applications";
    public static final String JOB_APPLICATION_COUNTS = "job_application_counts";

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    private static final Map<String, Set<String>> COLUMNS = Map.of(
        JOBS, Set.of(
            "id", "title", "company", "location", "description", "url", "salary_min", "salary_max",
            "job_type", "remote_friendly", "is_active", "expires_at", "created_at", "updated_at"
        ),
        USERS, Set.of(
            "id", "name", "email", "password_hash", "subscription_plan", "last_login", "created_at", "updated_at"
        ),
        APPLICATIONS, Set.of(
            "id", "user_id", "job_id", "cover_letter", "status", "notes", "created_at", "updated_at"
        ),
        JOB_APPLICATION_COUNTS, Set.of("job_id", "application_count")
    );

    private static final Set<String> READ_ONLY = Set.of(JOB_APPLICATION_COUNTS);

    private ResourceSchema() {
    }

    public static boolean isKnownResource(String resource) {
        return resource != null && COLUMNS.containsKey(resource);
    }

    public static boolean isReadOnly(String resource) {
        return READ_ONLY.contains(resource);
    }

    public static boolean isKnownColumn(String resource, String column) {
        Set<String> columns = COLUMNS.get(resource);
        return columns != null && column != null && IDENTIFIER.matcher(column).matches() && columns.contains(column);
    }

    /**
     * Rejects unknown resources, columns and write attempts against aggregates.
     */
    public static void check(DataMethod method, String resource, RequestParams params) {
        if (!isKnownResource(resource)) {
            throw new PermanentDataServiceException(resource, "Unknown resource: " + resource);
        }
        if (method != DataMethod.GET && isReadOnly(resource)) {
            throw new PermanentDataServiceException(resource, "Resource is read-only: " + resource);
        }
        for (FilterCondition condition : params.filters()) {
            checkColumn(resource, condition.field());
        }
        for (var group : params.anyOf()) {
            for (FilterCondition condition : group) {
                checkColumn(resource, condition.field());
            }
        }
        for (SortOrder order : params.order()) {
            checkColumn(resource, order.field());
        }
        for (String column : params.body().keySet()) {
            checkColumn(resource, column);
        }
    }

    private static void checkColumn(String resource, String column) {
        if (!isKnownColumn(resource, column)) {
            throw new PermanentDataServiceException(resource, "Unknown column " + column + " on " + resource);
        }
    }
}
