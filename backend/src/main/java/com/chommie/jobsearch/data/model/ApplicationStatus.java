package com.chommie.jobsearch.data.model;

import java.util.Locale;

public enum ApplicationStatus {
    PENDING,
    REVIEWED,
    INTERVIEW,
    ACCEPTED,
    REJECTED;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ApplicationStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (ApplicationStatus status : values()) {
            if (status.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return status;
            }
        }
        return null;
    }
}
