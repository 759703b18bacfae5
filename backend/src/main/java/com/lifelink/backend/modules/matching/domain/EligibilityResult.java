package com.lifelink.backend.modules.matching.domain;

public record EligibilityResult(boolean eligible, String reason) {

    public static final String ELIGIBLE_REASON = "Donor is eligible";

    public static EligibilityResult ok() {
        return new EligibilityResult(true, ELIGIBLE_REASON);
    }

    public static EligibilityResult rejected(String reason) {
        return new EligibilityResult(false, reason);
    }
}
