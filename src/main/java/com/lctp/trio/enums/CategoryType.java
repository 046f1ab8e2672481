package com.lctp.trio.enums;

import com.lctp.trio.exception.UnknownCategoryTypeException;

import java.util.Locale;

public enum CategoryType {

    /**
     * Up to 12 years old, trios formed by full draw
     */
    BABY,

    /**
     * 13 to 17 years old
     */
    KIDS,

    /**
     * Combined trio age limited
     */
    MIRIM,

    /**
     * Female competitors only
     */
    FEMININA,

    /**
     * No composition restriction
     */
    ABERTA,

    /**
     * Combined trio handicap limited to 11
     */
    SOMA11;

    /**
     * Resolve a type from its name, case-insensitive. The legacy name "handicap" maps to SOMA11.
     */
    public static CategoryType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnknownCategoryTypeException(String.valueOf(name));
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("HANDICAP".equals(normalized)) {
            return SOMA11;
        }
        try {
            return CategoryType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new UnknownCategoryTypeException(name, e);
        }
    }
}
