package com.chommie.jobsearch.data.model;

import java.util.Locale;

public enum SubscriptionPlan {
    BASIC,
    PREMIUM,
    ENTERPRISE;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SubscriptionPlan fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (SubscriptionPlan plan : values()) {
            if (plan.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return plan;
            }
        }
        return null;
    }
}
