package com.lctp.trio.enums;

public enum Sex {
    M,
    F
}
