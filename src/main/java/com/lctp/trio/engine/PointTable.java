package com.lctp.trio.engine;

import com.lctp.trio.enums.CategoryType;

import java.math.BigDecimal;

/**
 * Placement to championship points. Implementations must be non-increasing in placement.
 */
public interface PointTable {

    BigDecimal pointsFor(int placement, int fieldSize, CategoryType categoryType);
}
