package com.lctp.trio.enums;

public enum QuotaState {

    /**
     * Competitor may compete and still has runs left
     */
    ACTIVE,

    /**
     * All allowed runs have been used
     */
    EXHAUSTED,

    /**
     * Administratively blocked, a reason is always present
     */
    BLOCKED
}
