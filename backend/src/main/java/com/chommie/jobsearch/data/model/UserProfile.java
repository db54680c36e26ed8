package com.chommie.jobsearch.data.model;

import java.util.List;

public record UserProfile(UserSummary user, List<ApplicationWithJob> applications, ApplicationStatistics statistics) {
}
