package com.chommie.jobsearch.data.model;

import java.time.Instant;

public record Application(
    String id,
    String userId,
    String jobId,
    String coverLetter,
    ApplicationStatus status,
    String notes,
    Instant createdAt,
    Instant updatedAt
) {
}
