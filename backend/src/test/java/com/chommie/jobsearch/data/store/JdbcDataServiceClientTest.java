package com.chommie.jobsearch.data.store;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcDataServiceClientTest {

    @Autowired
    private DataServiceClient client;

    @Test
    void insertAssignsIdAndReturnsStoredRow() {
        DataResult inserted = client.request(DataMethod.POST, ResourceSchema.JOBS, QueryFilter.builder()
            .body(jobValues("Platform Engineer", 60000, 90000))
            .build());

        Map<String, Object> row = inserted.firstRow().orElseThrow();
        assertThat(row.get("id")).isNotNull();
        assertThat(row.get("title")).isEqualTo("Platform Engineer");
        assertThat(row.get("created_at")).isInstanceOf(Instant.class);
    }

    @Test
    void patternSearchTreatsWildcardsLiterally() {
        String marker = "mk" + UUID.randomUUID().toString().substring(0, 8);
        client.request(DataMethod.POST, ResourceSchema.JOBS, QueryFilter.builder()
            .body(jobValues("100% " + marker, null, null)).build());
        client.request(DataMethod.POST, ResourceSchema.JOBS, QueryFilter.builder()
            .body(jobValues("1000 " + marker, null, null)).build());

        DataResult result = client.request(DataMethod.GET, ResourceSchema.JOBS, QueryFilter.builder()
            .ilike("title", "100%")
            .ilike("title", marker)
            .withCount()
            .build());

        assertThat(result.rows()).extracting(r -> r.get("title")).containsExactly("100% " + marker);
        assertThat(result.totalCount()).isEqualTo(1L);
    }

    @Test
    void patchAndDeleteReturnAffectedRows() {
        String id = client.request(DataMethod.POST, ResourceSchema.JOBS, QueryFilter.builder()
            .body(jobValues("Data Engineer", null, null)).build()).firstRow().orElseThrow().get("id").toString();

        DataResult patched = client.request(DataMethod.PATCH, ResourceSchema.JOBS, QueryFilter.builder()
            .eq("id", id)
            .body(Map.of("title", "Senior Data Engineer"))
            .build());
        DataResult deleted = client.request(DataMethod.DELETE, ResourceSchema.JOBS, QueryFilter.builder().eq("id", id).build());
        DataResult after = client.request(DataMethod.GET, ResourceSchema.JOBS, QueryFilter.builder().eq("id", id).build());

        assertThat(patched.firstRow().orElseThrow().get("title")).isEqualTo("Senior Data Engineer");
        assertThat(deleted.rows()).hasSize(1);
        assertThat(after.isEmpty()).isTrue();
    }

    @Test
    void emptyInListMatchesNothing() {
        DataResult result = client.request(DataMethod.GET, ResourceSchema.JOBS, QueryFilter.builder()
            .in("id", List.of())
            .build());

        assertThat(result.rows()).isEmpty();
    }

    @Test
    void uniqueViolationIsAConflict() {
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("name", "Thandi");
        user.put("email", "dup-" + UUID.randomUUID() + "@example.com");
        user.put("password_hash", "x");
        user.put("created_at", Instant.now());
        user.put("updated_at", Instant.now());
        client.request(DataMethod.POST, ResourceSchema.USERS, QueryFilter.builder().body(user).build());

        assertThatThrownBy(() -> client.request(DataMethod.POST, ResourceSchema.USERS, QueryFilter.builder().body(user).build()))
            .isInstanceOfSatisfying(PermanentDataServiceException.class, e -> assertThat(e.isConflict()).isTrue());
    }

    @Test
    void unknownColumnsNeverReachTheDatabase() {
        assertThatThrownBy(() -> client.request(DataMethod.GET, ResourceSchema.JOBS, QueryFilter.builder()
            .eq("title; DROP TABLE jobs", "x")
            .build()))
            .isInstanceOf(PermanentDataServiceException.class);
    }

    @Test
    void aggregateViewIsReadOnly() {
        assertThatThrownBy(() -> client.request(DataMethod.POST, ResourceSchema.JOB_APPLICATION_COUNTS, QueryFilter.builder()
            .body(Map.of("job_id", "x"))
            .build()))
            .isInstanceOf(PermanentDataServiceException.class);
    }

    private static Map<String, Object> jobValues(String title, Integer salaryMin, Integer salaryMax) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("title", title);
        values.put("company", "Acme");
        values.put("salary_min", salaryMin);
        values.put("salary_max", salaryMax);
        values.put("job_type", "full-time");
        values.put("remote_friendly", false);
        values.put("is_active", true);
        values.put("created_at", Instant.now());
        values.put("updated_at", Instant.now());
        return values;
    }
}
