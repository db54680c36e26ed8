package com.chommie.jobsearch.data.model;

import java.util.List;

public record JobDetails(Job job, List<Job> similarJobs, boolean hasApplied) {
}
