package com.lctp.trio.service;

import com.lctp.trio.engine.PlacementCalculator;
import com.lctp.trio.entity.Competitor;
import com.lctp.trio.entity.ParticipationQuota;
import com.lctp.trio.entity.Prova;
import com.lctp.trio.entity.RunResult;
import com.lctp.trio.entity.Trio;
import com.lctp.trio.enums.TrioStatus;
import com.lctp.trio.exception.ConsistencyException;
import com.lctp.trio.exception.ResourceNotFoundException;
import com.lctp.trio.repository.RunResultRepository;
import com.lctp.trio.repository.TrioRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records trio runs and recomputes placements.
 * Both paths take row locks on the results they touch, so an edit and a
 * recomputation of the same category never interleave.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResultService {

    public static final int MAX_ATTEMPTS = 2;

    private final RunResultRepository runResultRepository;
    private final TrioRepository trioRepository;
    private final PlacementCalculator placementCalculator;
    private final ParticipationQuotaTracker quotaTracker;

    /**
     * Record (or correct) the run of a trio. The first recording consumes one run
     * from each member's quota; corrections do not. A correction that changes times or
     * flags of a ranked result clears its placement, so scoring refuses the event until
     * placements are recomputed.
     *
     * @param attemptTimes up to two attempt times in seconds; zero or null means no valid time
     * @param prize        gross prize, net value is derived from the event discount
     */
    @Transactional(timeoutString = "${contest.transaction.timeout-seconds:30}")
    public RunResult recordRun(Long resultId, List<BigDecimal> attemptTimes, boolean noTime,
                               boolean disqualified, BigDecimal prize, String notes) {
        RunResult result = runResultRepository.findByIdForUpdate(resultId)
                .orElseThrow(() -> new ResourceNotFoundException("Result not found: " + resultId));
        Trio trio = result.getTrio();
        if (trio == null || trio.isDeleted()) {
            log.error("Result id={} points to a missing or deleted trio", resultId);
            throw new ConsistencyException("Result " + resultId + " belongs to a deleted trio");
        }

        List<BigDecimal> attempts = attemptTimes == null ? List.of() : attemptTimes;
        if (attempts.size() > MAX_ATTEMPTS) {
            throw new IllegalArgumentException("At most " + MAX_ATTEMPTS + " attempt times are allowed, got " + attempts.size());
        }
        for (BigDecimal time : attempts) {
            if (time != null && time.signum() < 0) {
                throw new IllegalArgumentException("Attempt time cannot be negative: " + time);
            }
        }

        BigDecimal first = scaled(attempts.size() > 0 ? attempts.get(0) : null);
        BigDecimal second = scaled(attempts.size() > 1 ? attempts.get(1) : null);
        if (result.getPlacement() != null && changesRanking(result, first, second, noTime, disqualified)) {
            log.info("Result id={} changed after ranking, placement {} cleared until the next recomputation",
                    resultId, result.getPlacement());
            result.setPlacement(null);
        }
        result.setFirstAttemptTime(first);
        result.setSecondAttemptTime(second);
        result.setNoTime(noTime);
        result.setDisqualified(disqualified);
        result.recalculateAverage();
        if (notes != null) {
            result.setNotes(notes);
        }

        Prova prova = result.getProva();
        if (prize != null) {
            if (prize.signum() < 0) {
                throw new IllegalArgumentException("Prize cannot be negative: " + prize);
            }
            result.setPrizeAmount(prize.setScale(2, RoundingMode.HALF_UP));
            result.setNetPrizeAmount(prova.netPrize(prize));
        }

        trio.setStatus(switch (result.exclusionKind()) {
            case TIMED -> TrioStatus.ACTIVE;
            case NO_TIME -> TrioStatus.NO_TIME;
            case DISQUALIFIED -> TrioStatus.DISQUALIFIED;
        });
        trioRepository.save(trio);

        List<Long> quotaIds = new ArrayList<>();
        if (!result.isRecorded()) {
            for (Competitor member : trio.getMembers()) {
                ParticipationQuota quota = quotaTracker.ensureQuota(member, prova, trio.getCategory());
                quotaIds.add(quota.getId());
            }
            result.setRecorded(true);
        }
        RunResult saved = runResultRepository.save(result);

        // registerRun clears the persistence context, so no lazy association may be read after this point
        for (Long quotaId : quotaIds) {
            quotaTracker.registerRun(quotaId);
        }
        log.info("Recorded run for trio #{} (result id={}): average={} noTime={} disqualified={} prize={}",
                trio.getTrioNumber(), resultId, saved.getAverageTime(), noTime, disqualified, saved.getPrizeAmount());
        return saved;
    }

    /**
     * Recompute placements of an event, for one category or all of them.
     * Every result of the scope is locked first; a single inconsistency rolls back the whole batch.
     *
     * @return the results in final order, grouped by category
     */
    @Transactional(timeoutString = "${contest.transaction.timeout-seconds:30}")
    public List<RunResult> recomputePlacements(Long provaId, Long categoryId) {
        List<RunResult> snapshot = runResultRepository.findForRecomputation(provaId, categoryId);
        if (snapshot.isEmpty()) {
            log.info("No results to rank for event={} category={}", provaId, categoryId);
            return List.of();
        }

        Map<Long, List<RunResult>> byCategory = groupByCategory(snapshot);
        List<RunResult> ranked = new ArrayList<>(snapshot.size());
        byCategory.forEach((catId, results) -> ranked.addAll(placementCalculator.rank(results)));

        runResultRepository.saveAll(ranked);
        log.info("Recomputed placements for event={}: {} result(s) across {} categor(ies)",
                provaId, ranked.size(), byCategory.size());
        return ranked;
    }

    @Transactional(readOnly = true)
    public RunResult getResult(Long resultId) {
        return runResultRepository.findById(resultId)
                .orElseThrow(() -> new ResourceNotFoundException("Result not found: " + resultId));
    }

    @Transactional(readOnly = true)
    public List<RunResult> listResults(Long provaId, Long categoryId) {
        return runResultRepository.findByProvaAndCategory(provaId, categoryId);
    }

    /**
     * Groups results by category keeping id order, rejecting results of deleted trios.
     */
    static Map<Long, List<RunResult>> groupByCategory(List<RunResult> snapshot) {
        Map<Long, List<RunResult>> byCategory = new LinkedHashMap<>();
        for (RunResult result : snapshot) {
            Trio trio = result.getTrio();
            if (trio == null || trio.isDeleted()) {
                log.error("Result id={} points to a missing or deleted trio, aborting recomputation", result.getId());
                throw new ConsistencyException("Result " + result.getId() + " belongs to a deleted trio");
            }
            byCategory.computeIfAbsent(trio.getCategory().getId(), k -> new ArrayList<>()).add(result);
        }
        return byCategory;
    }

    private static boolean changesRanking(RunResult current, BigDecimal first, BigDecimal second,
                                          boolean noTime, boolean disqualified) {
        return current.isNoTime() != noTime
                || current.isDisqualified() != disqualified
                || !sameTime(current.getFirstAttemptTime(), first)
                || !sameTime(current.getSecondAttemptTime(), second);
    }

    private static boolean sameTime(BigDecimal a, BigDecimal b) {
        return a == null ? b == null : b != null && a.compareTo(b) == 0;
    }

    private static BigDecimal scaled(BigDecimal time) {
        return time == null ? null : time.setScale(RunResult.TIME_SCALE, RoundingMode.HALF_UP);
    }
}
