package com.lctp.trio.enums;

/**
 * Ranking group of a result. Groups are placed in declaration order.
 */
public enum ExclusionKind {
    TIMED,
    NO_TIME,
    DISQUALIFIED
}
