package com.chommie.jobsearch.data.persistence;

import com.chommie.jobsearch.config.JobSearchProperties;
import com.chommie.jobsearch.data.model.Application;
import com.chommie.jobsearch.data.model.ApplicationStatus;
import com.chommie.jobsearch.data.model.ApplicationWithJob;
import com.chommie.jobsearch.data.model.EntityKind;
import com.chommie.jobsearch.data.model.Job;
import com.chommie.jobsearch.data.store.QueryFilter;
import com.chommie.jobsearch.data.util.Rows;
import com.chommie.jobsearch.data.validation.EntityValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class ApplicationRepository extends AbstractStoreRepository<Application> {
    private static final Logger log = LoggerFactory.getLogger(ApplicationRepository.class);

    private final JobRepository jobRepository;

    public ApplicationRepository(
        StoreRequestExecutor executor,
        EntityValidator validator,
        JobSearchProperties properties,
        Clock clock,
        JobRepository jobRepository
    ) {
        super(EntityKind.APPLICATION, executor, validator, properties, clock);
        this.jobRepository = jobRepository;
    }

    /**
     * All of a user's applications, newest first, read in pages of {@code batchCap}.
     */
    public List<Application> findByUser(String userId) {
        if (userId == null || userId.isBlank()) {
            return List.of();
        }
        int pageSize = properties.getStore().getBatchCap();
        List<Application> applications = new ArrayList<>();
        int offset = 0;
        while (true) {
            List<Application> page = mapRows(get(QueryFilter.builder()
                .eq("user_id", userId)
                .orderBy("created_at", false)
                .orderBy("id", true)
                .limit(pageSize)
                .offset(offset)
                .build()));
            applications.addAll(page);
            if (page.size() < pageSize) {
                return applications;
            }
            offset += pageSize;
        }
    }

    /**
     * A user's applications with their jobs attached. Jobs are resolved with batched id
     * lookups; an application whose job is gone keeps a null job.
     */
    public List<ApplicationWithJob> getUserApplications(String userId) {
        List<Application> applications = findByUser(userId);
        if (applications.isEmpty()) {
            return List.of();
        }
        List<String> jobIds = new ArrayList<>(applications.size());
        for (Application application : applications) {
            jobIds.add(application.jobId());
        }
        Map<String, Job> jobsById = new HashMap<>();
        for (Job job : jobRepository.findByIds(jobIds)) {
            jobsById.put(job.id(), job);
        }
        List<ApplicationWithJob> out = new ArrayList<>(applications.size());
        for (Application application : applications) {
            Job job = jobsById.get(application.jobId());
            if (job == null) {
                log.debug("Application {} references missing job {}", application.id(), application.jobId());
            }
            out.add(new ApplicationWithJob(application, job));
        }
        return out;
    }

    public Optional<Application> findByUserAndJob(String userId, String jobId) {
        if (userId == null || userId.isBlank() || jobId == null || jobId.isBlank()) {
            return Optional.empty();
        }
        return get(QueryFilter.builder()
            .eq("user_id", userId)
            .eq("job_id", jobId)
            .limit(1)
            .build())
            .firstRow()
            .map(this::mapRow);
    }

    @Override
    protected Application mapRow(Map<String, Object> row) {
        return new Application(
            Rows.string(row, "id"),
            Rows.string(row, "user_id"),
            Rows.string(row, "job_id"),
            Rows.string(row, "cover_letter"),
            ApplicationStatus.fromWire(Rows.string(row, "status")),
            Rows.string(row, "notes"),
            Rows.instant(row, "created_at"),
            Rows.instant(row, "updated_at")
        );
    }
}
