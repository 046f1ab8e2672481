package com.lctp.trio.model;

public record EligibilityResult(boolean valid, String reason) {

    public static final String VALID_REASON = "Trio is valid";

    public static EligibilityResult ok() {
        return new EligibilityResult(true, VALID_REASON);
    }

    public static EligibilityResult rejected(String reason) {
        return new EligibilityResult(false, reason);
    }
}
