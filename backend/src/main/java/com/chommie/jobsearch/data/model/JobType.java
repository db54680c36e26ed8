package com.chommie.jobsearch.data.model;

import java.util.Locale;

public enum JobType {
    FULL_TIME("full-time"),
    PART_TIME("part-time"),
    CONTRACT("contract"),
    INTERNSHIP("internship");

    private final String wireValue;

    JobType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static JobType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (JobType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
