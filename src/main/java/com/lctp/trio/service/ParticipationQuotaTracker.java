package com.lctp.trio.service;

import com.lctp.trio.config.QuotaProperties;
import com.lctp.trio.entity.Category;
import com.lctp.trio.entity.Competitor;
import com.lctp.trio.entity.ParticipationQuota;
import com.lctp.trio.entity.Prova;
import com.lctp.trio.exception.DuplicateQuotaException;
import com.lctp.trio.exception.QuotaBlockedException;
import com.lctp.trio.exception.QuotaExhaustedException;
import com.lctp.trio.exception.ResourceNotFoundException;
import com.lctp.trio.repository.CategoryRepository;
import com.lctp.trio.repository.CompetitorRepository;
import com.lctp.trio.repository.ParticipationQuotaRepository;
import com.lctp.trio.repository.ProvaRepository;
import com.lctp.trio.repository.RunConfigurationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tracks how many runs each competitor may still make per event/category.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ParticipationQuotaTracker {

    private final ParticipationQuotaRepository quotaRepository;
    private final RunConfigurationRepository runConfigurationRepository;
    private final ProvaRepository provaRepository;
    private final CompetitorRepository competitorRepository;
    private final CategoryRepository categoryRepository;
    private final QuotaProperties quotaProperties;
    private final Clock clock;

    /**
     * Create a quota for the key (competitor, event, category).
     *
     * @throws DuplicateQuotaException if a quota already exists for the key
     */
    @Transactional
    public ParticipationQuota create(Competitor competitor, Prova prova, Category category, int maxRuns) {
        if (competitor == null || prova == null || category == null) {
            throw new IllegalArgumentException("Competitor, event and category are required");
        }
        if (maxRuns < 0) {
            throw new IllegalArgumentException("Max runs cannot be negative: " + maxRuns);
        }
        if (quotaRepository.existsByCompetitor_IdAndProva_IdAndCategory_Id(
                competitor.getId(), prova.getId(), category.getId())) {
            throw new DuplicateQuotaException(String.format(
                    "Quota already exists for competitor=%d event=%d category=%d",
                    competitor.getId(), prova.getId(), category.getId()));
        }

        ParticipationQuota quota = ParticipationQuota.builder()
                .competitor(competitor)
                .prova(prova)
                .category(category)
                .maxRunsAllowed(maxRuns)
                .build();
        try {
            quota = quotaRepository.saveAndFlush(quota);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateQuotaException(String.format(
                    "Quota already exists for competitor=%d event=%d category=%d",
                    competitor.getId(), prova.getId(), category.getId()), e);
        }
        log.info("Created quota id={} competitor={} event={} category={} maxRuns={}",
                quota.getId(), competitor.getId(), prova.getId(), category.getId(), maxRuns);
        return quota;
    }

    @Transactional
    public ParticipationQuota create(Long competitorId, Long provaId, Long categoryId, Integer maxRuns) {
        Competitor competitor = competitorRepository.findByIdAndDeletedAtIsNull(competitorId)
                .orElseThrow(() -> new ResourceNotFoundException("Competitor not found: " + competitorId));
        Prova prova = provaRepository.findByIdAndDeletedAtIsNull(provaId)
                .orElseThrow(() -> new ResourceNotFoundException("Event not found: " + provaId));
        Category category = categoryRepository.findById(categoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Category not found: " + categoryId));
        int max = maxRuns != null ? maxRuns : configuredMaxRuns(prova, category);
        return create(competitor, prova, category, max);
    }

    /**
     * Existing quota for the key, or a new one with the configured maximum.
     */
    @Transactional
    public ParticipationQuota ensureQuota(Competitor competitor, Prova prova, Category category) {
        return quotaRepository.findByCompetitor_IdAndProva_IdAndCategory_Id(
                        competitor.getId(), prova.getId(), category.getId())
                .orElseGet(() -> create(competitor, prova, category, configuredMaxRuns(prova, category)));
    }

    /**
     * Consume one run. A single conditional update, so two concurrent calls
     * can never both take the last run.
     */
    @Transactional
    public ParticipationQuota registerRun(Long quotaId) {
        int updated = quotaRepository.incrementRunIfAvailable(quotaId);
        ParticipationQuota quota = getQuota(quotaId);
        if (updated == 0) {
            if (!quota.isMayCompete()) {
                log.warn("Run rejected, quota id={} is blocked: {}", quotaId, quota.getBlockReason());
                throw new QuotaBlockedException(String.format(
                        "Competitor %d is blocked for this event/category: %s",
                        quota.getCompetitor().getId(), quota.getBlockReason()));
            }
            log.warn("Run rejected, quota id={} exhausted ({}/{})",
                    quotaId, quota.getRunsExecuted(), quota.getMaxRunsAllowed());
            throw new QuotaExhaustedException(String.format(
                    "Competitor %d has no runs left (%d of %d used)",
                    quota.getCompetitor().getId(), quota.getRunsExecuted(), quota.getMaxRunsAllowed()));
        }
        log.info("Run registered on quota id={}: {}/{} used",
                quotaId, quota.getRunsExecuted(), quota.getMaxRunsAllowed());
        return quota;
    }

    @Transactional
    public ParticipationQuota block(Long quotaId, String reason) {
        ParticipationQuota quota = getQuota(quotaId);
        quota.block(reason);
        log.info("Blocked quota id={}: {}", quotaId, reason);
        return quotaRepository.save(quota);
    }

    @Transactional
    public ParticipationQuota unblock(Long quotaId) {
        ParticipationQuota quota = getQuota(quotaId);
        quota.unblock();
        log.info("Unblocked quota id={}", quotaId);
        return quotaRepository.save(quota);
    }

    /**
     * Administrative override. Executed runs may be set above the maximum;
     * the remaining count then reads zero.
     */
    @Transactional
    public ParticipationQuota update(Long quotaId, Integer maxRuns, Integer runsExecuted) {
        ParticipationQuota quota = getQuota(quotaId);
        if (maxRuns != null) {
            if (maxRuns < 0) {
                throw new IllegalArgumentException("Max runs cannot be negative: " + maxRuns);
            }
            quota.setMaxRunsAllowed(maxRuns);
        }
        if (runsExecuted != null) {
            if (runsExecuted < 0) {
                throw new IllegalArgumentException("Runs executed cannot be negative: " + runsExecuted);
            }
            quota.setRunsExecuted(runsExecuted);
        }
        log.info("Updated quota id={}: {}/{} used", quotaId, quota.getRunsExecuted(), quota.getMaxRunsAllowed());
        return quotaRepository.save(quota);
    }

    /**
     * Create the missing quotas of a competitor for every upcoming active event,
     * in the competitor's assigned category when that category is active.
     * Existing keys are left untouched.
     *
     * @return the quotas created by this call
     */
    @Transactional
    public List<ParticipationQuota> autoProvision(Long competitorId) {
        Competitor competitor = competitorRepository.findByIdAndDeletedAtIsNull(competitorId)
                .orElseThrow(() -> new ResourceNotFoundException("Competitor not found: " + competitorId));
        Category category = competitor.getCategory();
        if (category == null) {
            log.info("Competitor {} has no assigned category, nothing to provision", competitorId);
            return List.of();
        }
        if (!category.isActive()) {
            log.info("Category {} of competitor {} is inactive, nothing to provision", category.getId(), competitorId);
            return List.of();
        }

        List<ParticipationQuota> created = new ArrayList<>();
        for (Prova prova : provaRepository.findUpcoming(LocalDate.now(clock))) {
            if (quotaRepository.existsByCompetitor_IdAndProva_IdAndCategory_Id(
                    competitorId, prova.getId(), category.getId())) {
                continue;
            }
            created.add(create(competitor, prova, category, configuredMaxRuns(prova, category)));
        }
        log.info("Auto-provisioned {} quota(s) for competitor {}", created.size(), competitorId);
        return created;
    }

    @Transactional(readOnly = true)
    public Optional<ParticipationQuota> find(Long competitorId, Long provaId, Long categoryId) {
        return quotaRepository.findByCompetitor_IdAndProva_IdAndCategory_Id(competitorId, provaId, categoryId);
    }

    @Transactional(readOnly = true)
    public List<ParticipationQuota> listForCompetitor(Long competitorId) {
        return quotaRepository.findByCompetitor_IdOrderByIdAsc(competitorId);
    }

    @Transactional(readOnly = true)
    public List<ParticipationQuota> list(Long provaId, Long categoryId, boolean onlyBlocked) {
        return quotaRepository.search(provaId, categoryId, onlyBlocked);
    }

    @Transactional(readOnly = true)
    public ParticipationQuota getQuota(Long quotaId) {
        return quotaRepository.findById(quotaId)
                .orElseThrow(() -> new ResourceNotFoundException("Quota not found: " + quotaId));
    }

    /**
     * Active run configuration of the event/category, else the per-type default,
     * else the system default.
     */
    int configuredMaxRuns(Prova prova, Category category) {
        return runConfigurationRepository.findByProva_IdAndCategory_IdAndActiveTrue(prova.getId(), category.getId())
                .map(rc -> rc.getMaxRunsPerCompetitor())
                .orElseGet(() -> quotaProperties.maxRunsFor(category.getType()));
    }
}
