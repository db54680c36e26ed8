package com.chommie.jobsearch.data.model;

public record AuthenticationResult(boolean success, UserSummary user, String error) {
    public static AuthenticationResult authenticated(UserSummary user) {
        return new AuthenticationResult(true, user, null);
    }

    public static AuthenticationResult failed(String error) {
        return new AuthenticationResult(false, null, error);
    }

    public boolean locked() {
        return ErrorCodes.ACCOUNT_LOCKED.equals(error);
    }
}
