package com.lctp.trio.service;

import com.lctp.trio.engine.ContepScoringEngine;
import com.lctp.trio.entity.CompetitorScore;
import com.lctp.trio.entity.RunResult;
import com.lctp.trio.exception.ConsistencyException;
import com.lctp.trio.model.ScoreRecord;
import com.lctp.trio.repository.CompetitorScoreRepository;
import com.lctp.trio.repository.RunResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns final placements into stored CONTEP scores.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScoringService {

    private final RunResultRepository runResultRepository;
    private final CompetitorScoreRepository competitorScoreRepository;
    private final ContepScoringEngine scoringEngine;

    /**
     * Score an event (one category, or all when {@code categoryId} is null).
     * Existing scores of the scored categories are replaced in the same transaction.
     *
     * @throws ConsistencyException if any result of the scope has no placement yet
     */
    @Transactional(timeoutString = "${contest.transaction.timeout-seconds:30}")
    public List<ScoreRecord> computeScores(Long provaId, Long categoryId) {
        List<RunResult> snapshot = runResultRepository.findForRecomputation(provaId, categoryId);
        if (snapshot.isEmpty()) {
            log.info("No results to score for event={} category={}", provaId, categoryId);
            return List.of();
        }

        List<Long> unplaced = snapshot.stream()
                .filter(r -> r.getPlacement() == null)
                .map(RunResult::getId)
                .toList();
        if (!unplaced.isEmpty()) {
            log.error("Cannot score event={}: results without placement {}", provaId, unplaced);
            throw new ConsistencyException("Placements must be computed before scoring, missing for results " + unplaced);
        }

        Map<Long, List<RunResult>> byCategory = ResultService.groupByCategory(snapshot);
        List<ScoreRecord> records = new ArrayList<>();
        byCategory.values().forEach(results -> {
            List<RunResult> ranked = new ArrayList<>(results);
            ranked.sort(Comparator.comparing(RunResult::getPlacement));
            records.addAll(scoringEngine.scoreAll(ranked));
        });

        int removed = competitorScoreRepository.deleteByProvaAndCategories(provaId, byCategory.keySet());
        competitorScoreRepository.saveAll(records.stream().map(ScoringService::toEntity).toList());

        log.info("Scored event={}: {} record(s) across {} categor(ies), {} previous record(s) replaced",
                provaId, records.size(), byCategory.size(), removed);
        return records;
    }

    @Transactional(readOnly = true)
    public List<CompetitorScore> scoresForEvent(Long provaId) {
        return competitorScoreRepository.findByProvaIdOrderByCategoryIdAscPlacementAsc(provaId);
    }

    @Transactional(readOnly = true)
    public List<CompetitorScore> scoresForCompetitor(Long competitorId) {
        return competitorScoreRepository.findByCompetitorIdOrderByProvaIdAsc(competitorId);
    }

    private static CompetitorScore toEntity(ScoreRecord record) {
        return CompetitorScore.builder()
                .competitorId(record.competitorId())
                .provaId(record.eventId())
                .categoryId(record.categoryId())
                .trioId(record.trioId())
                .placement(record.placement())
                .placementPoints(record.placementPoints())
                .prizePoints(record.prizePoints())
                .totalPoints(record.totalPoints())
                .prizeShare(record.prizeShare())
                .build();
    }
}
