package com.lctp.trio.engine;

import com.lctp.trio.config.ContepProperties;
import com.lctp.trio.enums.CategoryType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Point table backed by {@link ContepProperties}. A category curve wins over the
 * small-field curve, which wins over the default curve.
 */
@Slf4j
public class ConfiguredPointTable implements PointTable {

    private final List<BigDecimal> defaultCurve;
    private final Map<CategoryType, List<BigDecimal>> categoryCurves;
    private final Integer smallFieldMaxSize;
    private final List<BigDecimal> smallFieldCurve;

    public ConfiguredPointTable(ContepProperties properties) {
        this.defaultCurve = checkedCurve("default", properties.getPointsCurve());
        Map<CategoryType, List<BigDecimal>> curves = new EnumMap<>(CategoryType.class);
        properties.getCategoryCurves().forEach((type, curve) -> curves.put(type, checkedCurve(type.name(), curve)));
        this.categoryCurves = Collections.unmodifiableMap(curves);
        this.smallFieldMaxSize = properties.getSmallFieldMaxSize();
        this.smallFieldCurve = smallFieldMaxSize == null
                ? List.of()
                : checkedCurve("small-field", properties.getSmallFieldCurve());

        log.info("CONTEP point table loaded | default={} | categoryCurves={} | smallFieldMaxSize={}",
                defaultCurve, categoryCurves.keySet(), smallFieldMaxSize);
    }

    @Override
    public BigDecimal pointsFor(int placement, int fieldSize, CategoryType categoryType) {
        List<BigDecimal> curve = curveFor(fieldSize, categoryType);
        if (placement < 1 || placement > curve.size()) {
            return BigDecimal.ZERO;
        }
        return curve.get(placement - 1);
    }

    List<BigDecimal> curveFor(int fieldSize, CategoryType categoryType) {
        List<BigDecimal> byCategory = categoryType == null ? null : categoryCurves.get(categoryType);
        if (byCategory != null) {
            return byCategory;
        }
        if (smallFieldMaxSize != null && fieldSize <= smallFieldMaxSize) {
            return smallFieldCurve;
        }
        return defaultCurve;
    }

    private static List<BigDecimal> checkedCurve(String name, List<BigDecimal> curve) {
        if (curve == null || curve.isEmpty()) {
            throw new IllegalStateException("CONTEP curve '" + name + "' must not be empty");
        }
        BigDecimal previous = null;
        for (BigDecimal points : curve) {
            if (points == null || points.signum() < 0) {
                throw new IllegalStateException("CONTEP curve '" + name + "' has a negative or missing value: " + curve);
            }
            if (previous != null && points.compareTo(previous) > 0) {
                throw new IllegalStateException("CONTEP curve '" + name + "' must be non-increasing: " + curve);
            }
            previous = points;
        }
        return List.copyOf(curve);
    }
}
