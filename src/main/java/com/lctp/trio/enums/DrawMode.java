package com.lctp.trio.enums;

public enum DrawMode {

    /**
     * Draw not permitted for the category
     */
    NONE,

    /**
     * Whole pool shuffled into trios
     */
    FULL,

    /**
     * A bounded sample of the pool is drawn, always a multiple of three
     */
    PARTIAL,

    /**
     * Trios searched so the combined age stays within the limit
     */
    AGE_RESTRICTED,

    /**
     * Shuffled pool, each candidate trio validated against the category rules
     */
    OPEN,

    /**
     * Rotation where each competitor joins several trios, up to the configured runs per competitor
     */
    MULTI_RUN
}
