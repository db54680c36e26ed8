package com.chommie.jobsearch.data.model;

import java.time.Instant;

public record User(
    String id,
    String name,
    String email,
    String passwordHash,
    SubscriptionPlan subscriptionPlan,
    Instant lastLogin,
    Instant createdAt,
    Instant updatedAt
) {
    public UserSummary toSummary() {
        return new UserSummary(id, name, email, subscriptionPlan, lastLogin, createdAt);
    }
}
