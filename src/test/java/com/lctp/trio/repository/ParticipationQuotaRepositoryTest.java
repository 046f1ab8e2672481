package com.lctp.trio.repository;

import com.lctp.trio.entity.Category;
import com.lctp.trio.entity.Competitor;
import com.lctp.trio.entity.ParticipationQuota;
import com.lctp.trio.entity.Prova;
import com.lctp.trio.enums.CategoryType;
import com.lctp.trio.enums.Sex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class ParticipationQuotaRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private ParticipationQuotaRepository quotaRepository;

    private Competitor competitor;
    private Prova prova;
    private Category category;

    @BeforeEach
    void setUp() {
        category = entityManager.persist(Category.builder().name("Kids").type(CategoryType.KIDS).build());
        competitor = entityManager.persist(Competitor.builder()
                .name("Ana")
                .birthDate(LocalDate.of(2010, 3, 1))
                .handicap(2)
                .sex(Sex.F)
                .category(category)
                .build());
        prova = entityManager.persist(Prova.builder().name("Copa").eventDate(LocalDate.now().plusDays(5)).build());
    }

    private ParticipationQuota persistQuota(int maxRuns) {
        return entityManager.persistFlushFind(ParticipationQuota.builder()
                .competitor(competitor)
                .prova(prova)
                .category(category)
                .maxRunsAllowed(maxRuns)
                .build());
    }

    @Test
    void incrementStopsAtTheMaximum() {
        Long id = persistQuota(2).getId();

        assertThat(quotaRepository.incrementRunIfAvailable(id)).isEqualTo(1);
        assertThat(quotaRepository.incrementRunIfAvailable(id)).isEqualTo(1);
        assertThat(quotaRepository.incrementRunIfAvailable(id)).isZero();

        ParticipationQuota reloaded = quotaRepository.findById(id).orElseThrow();
        assertThat(reloaded.getRunsExecuted()).isEqualTo(2);
        assertThat(reloaded.getRunsRemaining()).isZero();
    }

    @Test
    void blockedQuotaIsNeverIncremented() {
        ParticipationQuota quota = persistQuota(3);
        quota.block("suspended");
        entityManager.flush();

        assertThat(quotaRepository.incrementRunIfAvailable(quota.getId())).isZero();
        assertThat(quotaRepository.findById(quota.getId()).orElseThrow().getRunsExecuted()).isZero();
    }

    @Test
    void lookupByKeyAndSearch() {
        ParticipationQuota quota = persistQuota(3);

        assertThat(quotaRepository.findByCompetitor_IdAndProva_IdAndCategory_Id(
                competitor.getId(), prova.getId(), category.getId())).contains(quota);
        assertThat(quotaRepository.search(prova.getId(), null, false)).containsExactly(quota);
        assertThat(quotaRepository.search(null, null, true)).isEmpty();
    }
}
