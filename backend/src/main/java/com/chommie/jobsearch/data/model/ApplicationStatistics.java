package com.chommie.jobsearch.data.model;

import java.util.Map;

public record ApplicationStatistics(int total, Map<ApplicationStatus, Integer> byStatus) {
}
