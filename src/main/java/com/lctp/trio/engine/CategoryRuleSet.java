package com.lctp.trio.engine;

import com.lctp.trio.enums.CategoryType;
import com.lctp.trio.enums.DrawMode;
import com.lctp.trio.enums.Sex;
import com.lctp.trio.exception.UnknownCategoryTypeException;
import com.lctp.trio.model.RuleSet;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Rule table with exactly one {@link RuleSet} per {@link CategoryType}.
 * Built once at start-up and shared read-only.
 */
public final class CategoryRuleSet {

    public static final int DEFAULT_MAX_DRAW_POOL = 9;
    public static final int DEFAULT_MIN_DRAW_POOL = 3;

    private final Map<CategoryType, RuleSet> rules;

    private CategoryRuleSet(Map<CategoryType, RuleSet> rules) {
        this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
    }

    public static CategoryRuleSet standard() {
        Map<CategoryType, RuleSet> table = new EnumMap<>(CategoryType.class);
        for (CategoryType type : CategoryType.values()) {
            table.put(type, standardRules(type));
        }
        return new CategoryRuleSet(table);
    }

    private static RuleSet standardRules(CategoryType type) {
        return switch (type) {
            case BABY -> RuleSet.builder()
                    .type(type)
                    .maxIndividualAge(12)
                    .drawMode(DrawMode.FULL)
                    .build();
            case KIDS -> RuleSet.builder()
                    .type(type)
                    .minIndividualAge(13)
                    .maxIndividualAge(17)
                    .drawMode(DrawMode.PARTIAL)
                    .minDrawPool(DEFAULT_MIN_DRAW_POOL)
                    .maxDrawPool(DEFAULT_MAX_DRAW_POOL)
                    .build();
            case MIRIM -> RuleSet.builder()
                    .type(type)
                    .maxCombinedAge(36)
                    .drawMode(DrawMode.AGE_RESTRICTED)
                    .build();
            case FEMININA -> RuleSet.builder()
                    .type(type)
                    .requiredSex(Sex.F)
                    .drawMode(DrawMode.PARTIAL)
                    .minDrawPool(DEFAULT_MIN_DRAW_POOL)
                    .maxDrawPool(DEFAULT_MAX_DRAW_POOL)
                    .build();
            case ABERTA -> RuleSet.builder()
                    .type(type)
                    .drawMode(DrawMode.OPEN)
                    .build();
            case SOMA11 -> RuleSet.builder()
                    .type(type)
                    .maxCombinedHandicap(11)
                    .drawMode(DrawMode.NONE)
                    .build();
        };
    }

    public RuleSet rulesFor(CategoryType type) {
        if (type == null) {
            throw new UnknownCategoryTypeException("null");
        }
        return rules.get(type);
    }

    public RuleSet rulesFor(String typeName) {
        return rulesFor(CategoryType.fromName(typeName));
    }

    public Map<CategoryType, RuleSet> asMap() {
        return rules;
    }
}
