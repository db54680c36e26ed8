package com.chommie.jobsearch.data.service;

import com.chommie.jobsearch.data.cache.CacheKeys;
import com.chommie.jobsearch.data.cache.ResultCacheManager;
import com.chommie.jobsearch.data.model.Application;
import com.chommie.jobsearch.data.model.ApplicationOutcome;
import com.chommie.jobsearch.data.model.ApplicationStatus;
import com.chommie.jobsearch.data.model.EntityKind;
import com.chommie.jobsearch.data.model.ErrorCodes;
import com.chommie.jobsearch.data.persistence.ApplicationRepository;
import com.chommie.jobsearch.data.persistence.DuplicateRecordException;
import com.chommie.jobsearch.data.persistence.JobRepository;
import com.chommie.jobsearch.data.persistence.RecordNotFoundException;
import com.chommie.jobsearch.data.persistence.StoreUnavailableException;
import com.chommie.jobsearch.data.validation.FieldError;
import com.chommie.jobsearch.data.validation.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Job applications. A user may apply to a job once; the store's unique (user_id, job_id)
 * index is the final arbiter when two submissions race.
 */
@Service
public class ApplicationService {
    private static final Logger log = LoggerFactory.getLogger(ApplicationService.class);

    private final ApplicationRepository applicationRepository;
    private final JobRepository jobRepository;
    private final ResultCacheManager cache;

    public ApplicationService(
        ApplicationRepository applicationRepository,
        JobRepository jobRepository,
        ResultCacheManager cache
    ) {
        this.applicationRepository = applicationRepository;
        this.jobRepository = jobRepository;
        this.cache = cache;
    }

    public ApplicationOutcome apply(String userId, String jobId, String coverLetter) {
        Map<String, Object> data = new HashMap<>();
        data.put("user_id", userId);
        data.put("job_id", jobId);
        if (coverLetter != null) {
            data.put("cover_letter", coverLetter);
        }
        try {
            if (jobId == null || jobId.isBlank() || jobRepository.getById(jobId).isEmpty()) {
                return ApplicationOutcome.failed(ErrorCodes.JOB_NOT_FOUND, List.of(new FieldError("job_id", "does not exist")));
            }
            if (applicationRepository.findByUserAndJob(userId, jobId).isPresent()) {
                return ApplicationOutcome.failed(ErrorCodes.ALREADY_APPLIED, List.of());
            }
            Application application = applicationRepository.create(data);
            invalidateAfterWrite();
            log.info("User {} applied to job {}", userId, jobId);
            return ApplicationOutcome.submitted(application);
        } catch (ValidationException e) {
            return ApplicationOutcome.failed(ErrorCodes.VALIDATION_FAILED, e.getFieldErrors());
        } catch (DuplicateRecordException e) {
            return ApplicationOutcome.failed(ErrorCodes.ALREADY_APPLIED, List.of());
        } catch (StoreUnavailableException e) {
            return ApplicationOutcome.failed(ErrorCodes.STORE_UNAVAILABLE, List.of());
        }
    }

    public ApplicationOutcome updateStatus(String applicationId, ApplicationStatus status, String notes) {
        Map<String, Object> patch = new HashMap<>();
        if (status != null) {
            patch.put("status", status.wireValue());
        }
        if (notes != null) {
            patch.put("notes", notes);
        }
        try {
            Application updated = applicationRepository.update(applicationId, patch);
            invalidateAfterWrite();
            return ApplicationOutcome.submitted(updated);
        } catch (ValidationException e) {
            return ApplicationOutcome.failed(ErrorCodes.VALIDATION_FAILED, e.getFieldErrors());
        } catch (RecordNotFoundException e) {
            return ApplicationOutcome.failed(ErrorCodes.APPLICATION_NOT_FOUND, List.of());
        } catch (StoreUnavailableException e) {
            return ApplicationOutcome.failed(ErrorCodes.STORE_UNAVAILABLE, List.of());
        }
    }

    private void invalidateAfterWrite() {
        cache.invalidateByPrefix(EntityKind.APPLICATION.cacheNamespace());
        cache.invalidateByPrefix(CacheKeys.namespace(EntityKind.JOB.resource(), CacheKeys.TRENDING));
        cache.invalidateByPrefix(EntityKind.USER.cacheNamespace());
    }
}
