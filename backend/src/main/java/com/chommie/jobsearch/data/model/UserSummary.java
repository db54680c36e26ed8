package com.chommie.jobsearch.data.model;

import java.time.Instant;

public record UserSummary(
    String id,
    String name,
    String email,
    SubscriptionPlan subscriptionPlan,
    Instant lastLogin,
    Instant createdAt
) {
}
