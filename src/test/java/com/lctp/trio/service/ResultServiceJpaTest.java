package com.lctp.trio.service;

import com.lctp.trio.config.ContestConfig;
import com.lctp.trio.engine.ContepScoringEngine;
import com.lctp.trio.engine.PlacementCalculator;
import com.lctp.trio.entity.Category;
import com.lctp.trio.entity.Competitor;
import com.lctp.trio.entity.ParticipationQuota;
import com.lctp.trio.entity.Prova;
import com.lctp.trio.entity.RunResult;
import com.lctp.trio.entity.Trio;
import com.lctp.trio.enums.CategoryType;
import com.lctp.trio.enums.Sex;
import com.lctp.trio.exception.ConsistencyException;
import com.lctp.trio.repository.ParticipationQuotaRepository;
import com.lctp.trio.repository.RunResultRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({ContestConfig.class, ResultService.class, ScoringService.class, ParticipationQuotaTracker.class,
        PlacementCalculator.class, ContepScoringEngine.class})
class ResultServiceJpaTest {

    @Autowired
    private TestEntityManager entityManager;
    @Autowired
    private ResultService resultService;
    @Autowired
    private ScoringService scoringService;
    @Autowired
    private ParticipationQuotaRepository quotaRepository;
    @Autowired
    private RunResultRepository runResultRepository;

    private Category category;
    private Prova prova;
    private List<Competitor> members;
    private RunResult first;
    private RunResult second;

    @BeforeEach
    void setUp() {
        category = entityManager.persist(Category.builder().name("Aberta").type(CategoryType.ABERTA).build());
        prova = entityManager.persist(Prova.builder().name("Copa").eventDate(LocalDate.now().plusDays(5)).build());
        members = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            members.add(entityManager.persist(Competitor.builder()
                    .name("Competitor " + i)
                    .birthDate(LocalDate.of(1990, 1, i))
                    .handicap(2)
                    .sex(Sex.M)
                    .build()));
        }
        first = persistResult(1, members.subList(0, 3));
        second = persistResult(2, members.subList(3, 6));

        // only the first member has a quota; the others get one on their first run
        entityManager.persist(ParticipationQuota.builder()
                .competitor(members.get(0))
                .prova(prova)
                .category(category)
                .maxRunsAllowed(4)
                .build());
        entityManager.flush();
    }

    private RunResult persistResult(int number, List<Competitor> trioMembers) {
        Trio trio = entityManager.persist(Trio.builder()
                .prova(prova)
                .category(category)
                .members(new ArrayList<>(trioMembers))
                .trioNumber(number)
                .handicapTotal(6)
                .ageTotal(100)
                .build());
        return entityManager.persist(RunResult.builder().trio(trio).prova(prova).build());
    }

    private void flushAndClear() {
        entityManager.flush();
        entityManager.clear();
    }

    private ParticipationQuota quotaOf(Competitor competitor) {
        return quotaRepository.findByCompetitor_IdAndProva_IdAndCategory_Id(
                competitor.getId(), prova.getId(), category.getId()).orElseThrow();
    }

    @Test
    void firstRecording_createsMissingQuotasAndConsumesOneRunEach() {
        resultService.recordRun(first.getId(), List.of(new BigDecimal("39.8")), false, false, null, null);

        for (Competitor member : members.subList(0, 3)) {
            assertThat(quotaOf(member).getRunsExecuted()).isEqualTo(1);
        }
        assertThat(quotaOf(members.get(0)).getMaxRunsAllowed()).isEqualTo(4);
        assertThat(quotaOf(members.get(1)).getMaxRunsAllowed()).isEqualTo(10);
        assertThat(runResultRepository.findById(first.getId()).orElseThrow().isRecorded()).isTrue();
    }

    @Test
    void correctionAfterRanking_blocksScoringUntilPlacementsAreRecomputed() {
        resultService.recordRun(first.getId(), List.of(new BigDecimal("39.8")), false, false, null, null);
        resultService.recordRun(second.getId(), List.of(new BigDecimal("42.1")), false, false, null, null);
        resultService.recomputePlacements(prova.getId(), category.getId());
        flushAndClear();

        resultService.recordRun(first.getId(), List.of(new BigDecimal("39.8")), false, true, null, null);
        flushAndClear();

        assertThat(runResultRepository.findById(first.getId()).orElseThrow().getPlacement()).isNull();
        assertThat(runResultRepository.findById(second.getId()).orElseThrow().getPlacement()).isEqualTo(2);
        assertThatThrownBy(() -> scoringService.computeScores(prova.getId(), category.getId()))
                .isInstanceOf(ConsistencyException.class)
                .hasMessageContaining("Placements must be computed");
    }

    @Test
    void recomputedCorrection_ranksTheTimedTrioFirst() {
        resultService.recordRun(first.getId(), List.of(new BigDecimal("39.8")), false, false, null, null);
        resultService.recordRun(second.getId(), List.of(new BigDecimal("42.1")), false, false, null, null);
        resultService.recomputePlacements(prova.getId(), category.getId());
        flushAndClear();
        resultService.recordRun(first.getId(), List.of(new BigDecimal("39.8")), false, true, null, null);
        flushAndClear();

        resultService.recomputePlacements(prova.getId(), category.getId());
        flushAndClear();

        assertThat(runResultRepository.findById(second.getId()).orElseThrow().getPlacement()).isEqualTo(1);
        assertThat(runResultRepository.findById(first.getId()).orElseThrow().getPlacement()).isEqualTo(2);
        assertThat(scoringService.computeScores(prova.getId(), category.getId()))
                .filteredOn(record -> record.trioId().equals(second.getTrio().getId()))
                .hasSize(3)
                .allSatisfy(record -> assertThat(record.placementPoints()).isEqualByComparingTo("10.00"));
    }
}
