package com.lctp.trio.service;

import com.lctp.trio.config.QuotaProperties;
import com.lctp.trio.entity.Category;
import com.lctp.trio.entity.Competitor;
import com.lctp.trio.entity.ParticipationQuota;
import com.lctp.trio.entity.Prova;
import com.lctp.trio.entity.RunConfiguration;
import com.lctp.trio.enums.CategoryType;
import com.lctp.trio.enums.QuotaState;
import com.lctp.trio.exception.DuplicateQuotaException;
import com.lctp.trio.exception.QuotaBlockedException;
import com.lctp.trio.exception.QuotaExhaustedException;
import com.lctp.trio.repository.CategoryRepository;
import com.lctp.trio.repository.CompetitorRepository;
import com.lctp.trio.repository.ParticipationQuotaRepository;
import com.lctp.trio.repository.ProvaRepository;
import com.lctp.trio.repository.RunConfigurationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.lctp.trio.Fixtures.CLOCK;
import static com.lctp.trio.Fixtures.TODAY;
import static com.lctp.trio.Fixtures.category;
import static com.lctp.trio.Fixtures.competitor;
import static com.lctp.trio.Fixtures.prova;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ParticipationQuotaTrackerTest {

    @Mock
    private ParticipationQuotaRepository quotaRepository;
    @Mock
    private RunConfigurationRepository runConfigurationRepository;
    @Mock
    private ProvaRepository provaRepository;
    @Mock
    private CompetitorRepository competitorRepository;
    @Mock
    private CategoryRepository categoryRepository;

    private ParticipationQuotaTracker tracker;

    private final Competitor competitor = competitor(1L, 15);
    private final Prova prova = prova(10L);
    private final Category kids = category(20L, CategoryType.KIDS);

    @BeforeEach
    void setUp() {
        tracker = new ParticipationQuotaTracker(quotaRepository, runConfigurationRepository, provaRepository,
                competitorRepository, categoryRepository, new QuotaProperties(), CLOCK);
    }

    /* -------------------------- Helpers -------------------------- */

    private ParticipationQuota quota(long id, int max, int executed) {
        return ParticipationQuota.builder()
                .id(id)
                .competitor(competitor)
                .prova(prova)
                .category(kids)
                .maxRunsAllowed(max)
                .runsExecuted(executed)
                .build();
    }

    // Mirrors the conditional update on an in-memory quota.
    private void simulateAtomicIncrement(ParticipationQuota quota) {
        when(quotaRepository.incrementRunIfAvailable(quota.getId())).thenAnswer(inv -> {
            if (quota.isMayCompete() && quota.getRunsExecuted() < quota.getMaxRunsAllowed()) {
                quota.setRunsExecuted(quota.getRunsExecuted() + 1);
                return 1;
            }
            return 0;
        });
        when(quotaRepository.findById(quota.getId())).thenReturn(Optional.of(quota));
    }

    /* ========================= TESTS ========================= */

    @Nested
    @DisplayName("registerRun")
    class RegisterRun {

        @Test
        void twoRuns_thenExhausted() {
            ParticipationQuota quota = quota(5L, 2, 0);
            simulateAtomicIncrement(quota);

            assertThat(tracker.registerRun(5L).getRunsRemaining()).isEqualTo(1);
            assertThat(tracker.registerRun(5L).getRunsRemaining()).isEqualTo(0);
            assertThat(quota.getState()).isEqualTo(QuotaState.EXHAUSTED);

            assertThatThrownBy(() -> tracker.registerRun(5L))
                    .isInstanceOf(QuotaExhaustedException.class)
                    .hasMessageContaining("2 of 2 used");
            assertThat(quota.getRunsExecuted()).isEqualTo(2);
        }

        @Test
        void blockedQuota_reportsReason() {
            ParticipationQuota quota = quota(6L, 3, 0);
            quota.block("unpaid registration");
            simulateAtomicIncrement(quota);

            assertThatThrownBy(() -> tracker.registerRun(6L))
                    .isInstanceOf(QuotaBlockedException.class)
                    .hasMessageContaining("unpaid registration");
            assertThat(quota.getRunsExecuted()).isZero();
        }
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        void existingKey_isDuplicate() {
            when(quotaRepository.existsByCompetitor_IdAndProva_IdAndCategory_Id(1L, 10L, 20L)).thenReturn(true);

            assertThatThrownBy(() -> tracker.create(competitor, prova, kids, 5))
                    .isInstanceOf(DuplicateQuotaException.class);
            verify(quotaRepository, never()).saveAndFlush(any());
        }

        @Test
        void newKey_startsActiveWithNoRunsUsed() {
            when(quotaRepository.existsByCompetitor_IdAndProva_IdAndCategory_Id(1L, 10L, 20L)).thenReturn(false);
            when(quotaRepository.saveAndFlush(any(ParticipationQuota.class))).thenAnswer(inv -> inv.getArgument(0));

            ParticipationQuota created = tracker.create(competitor, prova, kids, 4);

            assertThat(created.getRunsExecuted()).isZero();
            assertThat(created.getRunsRemaining()).isEqualTo(4);
            assertThat(created.getState()).isEqualTo(QuotaState.ACTIVE);
        }
    }

    @Nested
    @DisplayName("administration")
    class Administration {

        @Test
        void block_requiresReason() {
            when(quotaRepository.findById(7L)).thenReturn(Optional.of(quota(7L, 3, 0)));

            assertThatThrownBy(() -> tracker.block(7L, "  ")).isInstanceOf(IllegalArgumentException.class);
            verify(quotaRepository, never()).save(any());
        }

        @Test
        void blockThenUnblock() {
            ParticipationQuota quota = quota(7L, 3, 1);
            when(quotaRepository.findById(7L)).thenReturn(Optional.of(quota));
            when(quotaRepository.save(quota)).thenReturn(quota);

            assertThat(tracker.block(7L, "injury").getState()).isEqualTo(QuotaState.BLOCKED);
            assertThat(quota.getBlockReason()).isEqualTo("injury");

            assertThat(tracker.unblock(7L).getState()).isEqualTo(QuotaState.ACTIVE);
            assertThat(quota.getBlockReason()).isNull();
        }

        @Test
        void update_mayPushExecutedAboveMax() {
            ParticipationQuota quota = quota(8L, 3, 1);
            when(quotaRepository.findById(8L)).thenReturn(Optional.of(quota));
            when(quotaRepository.save(quota)).thenReturn(quota);

            ParticipationQuota updated = tracker.update(8L, 2, 5);

            assertThat(updated.getMaxRunsAllowed()).isEqualTo(2);
            assertThat(updated.getRunsExecuted()).isEqualTo(5);
            assertThat(updated.getRunsRemaining()).isZero();
            assertThat(updated.getState()).isEqualTo(QuotaState.EXHAUSTED);
        }
    }

    @Nested
    @DisplayName("autoProvision")
    class AutoProvision {

        @Test
        void createsMissingQuotas_withConfiguredOrDefaultMax() {
            competitor.setCategory(kids);
            Prova withConfig = prova(11L);
            Prova withoutConfig = prova(12L);
            when(competitorRepository.findByIdAndDeletedAtIsNull(1L)).thenReturn(Optional.of(competitor));
            when(provaRepository.findUpcoming(TODAY)).thenReturn(List.of(withConfig, withoutConfig));
            when(quotaRepository.existsByCompetitor_IdAndProva_IdAndCategory_Id(eq(1L), anyLong(), eq(20L)))
                    .thenReturn(false);
            when(runConfigurationRepository.findByProva_IdAndCategory_IdAndActiveTrue(11L, 20L))
                    .thenReturn(Optional.of(RunConfiguration.builder().maxRunsPerCompetitor(2).build()));
            when(runConfigurationRepository.findByProva_IdAndCategory_IdAndActiveTrue(12L, 20L))
                    .thenReturn(Optional.empty());
            when(quotaRepository.saveAndFlush(any(ParticipationQuota.class))).thenAnswer(inv -> inv.getArgument(0));

            List<ParticipationQuota> created = tracker.autoProvision(1L);

            assertThat(created).extracting(ParticipationQuota::getMaxRunsAllowed).containsExactly(2, 5);
            assertThat(created).extracting(q -> q.getProva().getId()).containsExactly(11L, 12L);
        }

        @Test
        void secondCall_createsNothing() {
            competitor.setCategory(kids);
            when(competitorRepository.findByIdAndDeletedAtIsNull(1L)).thenReturn(Optional.of(competitor));
            when(provaRepository.findUpcoming(TODAY)).thenReturn(List.of(prova(11L), prova(12L)));
            when(quotaRepository.existsByCompetitor_IdAndProva_IdAndCategory_Id(eq(1L), anyLong(), eq(20L)))
                    .thenReturn(true);

            assertThat(tracker.autoProvision(1L)).isEmpty();
            verify(quotaRepository, never()).saveAndFlush(any());
        }

        @Test
        void competitorWithoutCategory_getsNothing() {
            competitor.setCategory(null);
            when(competitorRepository.findByIdAndDeletedAtIsNull(1L)).thenReturn(Optional.of(competitor));

            assertThat(tracker.autoProvision(1L)).isEmpty();
            verifyNoInteractions(provaRepository, quotaRepository);
        }

        @Test
        void inactiveCategory_getsNothing() {
            kids.setActive(false);
            competitor.setCategory(kids);
            when(competitorRepository.findByIdAndDeletedAtIsNull(1L)).thenReturn(Optional.of(competitor));

            assertThat(tracker.autoProvision(1L)).isEmpty();
            verifyNoInteractions(provaRepository, quotaRepository);
        }
    }

    @Test
    void ensureQuota_returnsExistingQuota() {
        ParticipationQuota existing = quota(9L, 3, 1);
        when(quotaRepository.findByCompetitor_IdAndProva_IdAndCategory_Id(1L, 10L, 20L))
                .thenReturn(Optional.of(existing));

        assertThat(tracker.ensureQuota(competitor, prova, kids)).isSameAs(existing);
        verify(quotaRepository, never()).saveAndFlush(any());
    }

    @Test
    void ensureQuota_createsWithTypeDefault() {
        when(quotaRepository.findByCompetitor_IdAndProva_IdAndCategory_Id(1L, 10L, 20L)).thenReturn(Optional.empty());
        when(runConfigurationRepository.findByProva_IdAndCategory_IdAndActiveTrue(10L, 20L)).thenReturn(Optional.empty());
        when(quotaRepository.existsByCompetitor_IdAndProva_IdAndCategory_Id(1L, 10L, 20L)).thenReturn(false);
        ArgumentCaptor<ParticipationQuota> captor = ArgumentCaptor.forClass(ParticipationQuota.class);
        when(quotaRepository.saveAndFlush(captor.capture())).thenAnswer(inv -> inv.getArgument(0));

        tracker.ensureQuota(competitor, prova, kids);

        assertThat(captor.getValue().getMaxRunsAllowed()).isEqualTo(5);
    }
}
