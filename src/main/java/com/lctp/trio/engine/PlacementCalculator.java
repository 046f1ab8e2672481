package com.lctp.trio.engine;

import com.lctp.trio.entity.RunResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks the results of one event/category.
 *
 * Timed entries come first, ordered by average time, then by best single attempt,
 * then by their position in the input. No-time entries follow in input order and
 * disqualified entries close the ranking, also in input order.
 * Placements are written onto the given entries; the returned list is in final order.
 */
@Slf4j
@Component
public class PlacementCalculator {

    private static final Comparator<Ranked> TIMED_ORDER = Comparator
            .comparing((Ranked r) -> r.result().getAverageTime())
            .thenComparing(Ranked::bestAttempt)
            .thenComparingInt(Ranked::position);

    public List<RunResult> rank(List<RunResult> results) {
        if (results == null || results.isEmpty()) {
            return List.of();
        }

        List<Ranked> timed = new ArrayList<>();
        List<Ranked> noTime = new ArrayList<>();
        List<Ranked> disqualified = new ArrayList<>();

        for (int i = 0; i < results.size(); i++) {
            RunResult result = results.get(i);
            Ranked ranked = new Ranked(result, i, bestAttemptOf(result));
            switch (result.exclusionKind()) {
                case TIMED -> timed.add(ranked);
                case NO_TIME -> noTime.add(ranked);
                case DISQUALIFIED -> disqualified.add(ranked);
            }
        }

        timed.sort(TIMED_ORDER);

        List<RunResult> ordered = new ArrayList<>(results.size());
        int placement = 1;
        for (List<Ranked> group : List.of(timed, noTime, disqualified)) {
            for (Ranked ranked : group) {
                ranked.result().setPlacement(placement++);
                ordered.add(ranked.result());
            }
        }

        log.debug("Ranked {} results: timed={} noTime={} disqualified={}",
                ordered.size(), timed.size(), noTime.size(), disqualified.size());
        return ordered;
    }

    private static BigDecimal bestAttemptOf(RunResult result) {
        // a timed entry always has at least one valid attempt behind its average
        return result.bestAttempt().orElse(result.getAverageTime());
    }

    private record Ranked(RunResult result, int position, BigDecimal bestAttempt) {
    }
}
