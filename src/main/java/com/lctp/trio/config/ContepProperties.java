package com.lctp.trio.config;

import com.lctp.trio.enums.CategoryType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * CONTEP point curves. Index 0 of a curve holds the points for 1st place;
 * placements past the end of a curve score zero.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "contep")
public class ContepProperties {

    /** Points for 1st..10th place: 10, 9, ..., 1 */
    private List<BigDecimal> pointsCurve = new ArrayList<>(IntStream.rangeClosed(1, 10)
            .map(i -> 11 - i)
            .mapToObj(BigDecimal::valueOf)
            .toList());

    /** Curves replacing the default one for specific category types. */
    private Map<CategoryType, List<BigDecimal>> categoryCurves = new EnumMap<>(CategoryType.class);

    /** Fields with at most this many entries use {@link #smallFieldCurve}; null disables it. */
    private Integer smallFieldMaxSize;

    private List<BigDecimal> smallFieldCurve = new ArrayList<>();

    /** Net prize value worth one point (R$100 = 1 point). */
    private BigDecimal prizePointValue = new BigDecimal("100");

    /** Prize is split evenly across the trio members. */
    private int prizeShares = 3;
}
