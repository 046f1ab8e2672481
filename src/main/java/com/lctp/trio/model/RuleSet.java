package com.lctp.trio.model;

import com.lctp.trio.enums.CategoryType;
import com.lctp.trio.enums.DrawMode;
import com.lctp.trio.enums.Sex;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable composition and draw rules of one category type.
 * A null bound means the category does not restrict that value.
 */
@Value
@Builder
public class RuleSet {
    CategoryType type;

    Integer minIndividualAge;
    Integer maxIndividualAge;
    Integer maxCombinedAge;
    Integer maxCombinedHandicap;
    Sex requiredSex;

    @Builder.Default
    DrawMode drawMode = DrawMode.NONE;
    @Builder.Default
    int minDrawPool = 3;
    Integer maxDrawPool;

    public boolean hasIndividualAgeBound() {
        return minIndividualAge != null || maxIndividualAge != null;
    }

    public boolean isDrawAllowed() {
        return drawMode != DrawMode.NONE;
    }

    public boolean isFullTrioDraw() {
        return drawMode == DrawMode.FULL;
    }

    public boolean isUnrestricted() {
        return !hasIndividualAgeBound()
                && maxCombinedAge == null
                && maxCombinedHandicap == null
                && requiredSex == null;
    }

    public boolean acceptsAge(int age) {
        if (minIndividualAge != null && age < minIndividualAge) return false;
        return maxIndividualAge == null || age <= maxIndividualAge;
    }

    public String describeAgeBound() {
        if (minIndividualAge != null && maxIndividualAge != null) {
            return minIndividualAge + "-" + maxIndividualAge;
        }
        if (maxIndividualAge != null) {
            return "up to " + maxIndividualAge;
        }
        if (minIndividualAge != null) {
            return "from " + minIndividualAge;
        }
        return "any";
    }
}
