package com.lctp.trio.enums;

public enum TrioStatus {
    ACTIVE,
    NO_TIME,
    DISQUALIFIED
}
