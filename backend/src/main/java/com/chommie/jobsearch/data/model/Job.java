package com.chommie.jobsearch.data.model;

import java.time.Instant;

public record Job(
    String id,
    String title,
    String company,
    String location,
    String description,
    String url,
    Integer salaryMin,
    Integer salaryMax,
    JobType jobType,
    boolean remoteFriendly,
    boolean active,
    Instant expiresAt,
    Instant createdAt,
    Instant updatedAt
) {
}
