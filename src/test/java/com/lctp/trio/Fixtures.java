package com.lctp.trio;

import com.lctp.trio.entity.Category;
import com.lctp.trio.entity.Competitor;
import com.lctp.trio.entity.Prova;
import com.lctp.trio.entity.RunResult;
import com.lctp.trio.entity.Trio;
import com.lctp.trio.enums.CategoryType;
import com.lctp.trio.enums.Sex;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared test builders. All ages are relative to {@link #TODAY}.
 */
public final class Fixtures {

    public static final LocalDate TODAY = LocalDate.of(2024, 6, 15);
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);

    private Fixtures() {
    }

    public static Category category(long id, CategoryType type) {
        return Category.builder().id(id).name(type.name()).type(type).build();
    }

    public static Competitor competitor(long id, int age, int handicap, Sex sex) {
        return Competitor.builder()
                .id(id)
                .name("Competitor " + id)
                .birthDate(TODAY.minusYears(age).minusDays(1))
                .handicap(handicap)
                .sex(sex)
                .build();
    }

    public static Competitor competitor(long id, int age) {
        return competitor(id, age, 0, Sex.M);
    }

    public static Prova prova(long id) {
        return Prova.builder().id(id).name("Prova " + id).eventDate(TODAY.plusDays(10)).build();
    }

    public static Trio trio(long id, Prova prova, Category category, Competitor... members) {
        return Trio.builder()
                .id(id)
                .prova(prova)
                .category(category)
                .trioNumber((int) id)
                .members(new ArrayList<>(List.of(members)))
                .build();
    }

    public static RunResult timed(long id, Trio trio, String first, String second) {
        RunResult result = RunResult.builder()
                .id(id)
                .trio(trio)
                .prova(trio.getProva())
                .firstAttemptTime(first == null ? null : new BigDecimal(first))
                .secondAttemptTime(second == null ? null : new BigDecimal(second))
                .build();
        result.recalculateAverage();
        return result;
    }

    public static RunResult noTime(long id, Trio trio) {
        RunResult result = RunResult.builder().id(id).trio(trio).prova(trio.getProva()).noTime(true).build();
        result.recalculateAverage();
        return result;
    }

    public static RunResult disqualified(long id, Trio trio) {
        RunResult result = RunResult.builder().id(id).trio(trio).prova(trio.getProva()).disqualified(true).build();
        result.recalculateAverage();
        return result;
    }
}
