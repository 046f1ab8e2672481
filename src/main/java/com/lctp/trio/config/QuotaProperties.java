package com.lctp.trio.config;

import com.lctp.trio.enums.CategoryType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * Fallback run limits used when an event/category has no active run configuration.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "contest.quota")
public class QuotaProperties {

    private int defaultMaxRuns = 10;

    private Map<CategoryType, Integer> maxRunsByType = defaults();

    public int maxRunsFor(CategoryType type) {
        Integer configured = type == null ? null : maxRunsByType.get(type);
        return configured != null ? configured : defaultMaxRuns;
    }

    private static Map<CategoryType, Integer> defaults() {
        Map<CategoryType, Integer> map = new EnumMap<>(CategoryType.class);
        map.put(CategoryType.BABY, 3);
        map.put(CategoryType.KIDS, 5);
        map.put(CategoryType.MIRIM, 8);
        map.put(CategoryType.FEMININA, 8);
        map.put(CategoryType.ABERTA, 10);
        map.put(CategoryType.SOMA11, 10);
        return map;
    }
}
