package com.lctp.trio.service;

import com.lctp.trio.engine.TrioEligibilityValidator;
import com.lctp.trio.entity.Category;
import com.lctp.trio.entity.Competitor;
import com.lctp.trio.entity.ParticipationQuota;
import com.lctp.trio.entity.Prova;
import com.lctp.trio.entity.RunResult;
import com.lctp.trio.entity.Trio;
import com.lctp.trio.enums.QuotaState;
import com.lctp.trio.exception.ConsistencyException;
import com.lctp.trio.exception.QuotaBlockedException;
import com.lctp.trio.exception.QuotaExhaustedException;
import com.lctp.trio.exception.ResourceNotFoundException;
import com.lctp.trio.exception.TrioValidationException;
import com.lctp.trio.model.EligibilityResult;
import com.lctp.trio.repository.CategoryRepository;
import com.lctp.trio.repository.CompetitorRepository;
import com.lctp.trio.repository.ProvaRepository;
import com.lctp.trio.repository.RunResultRepository;
import com.lctp.trio.repository.TrioRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class TrioService {

    private final TrioRepository trioRepository;
    private final CompetitorRepository competitorRepository;
    private final CategoryRepository categoryRepository;
    private final ProvaRepository provaRepository;
    private final RunResultRepository runResultRepository;
    private final TrioEligibilityValidator validator;
    private final ParticipationQuotaTracker quotaTracker;
    private final Clock clock;

    /**
     * Dry run of the composition rules. Nothing is saved.
     */
    @Transactional(readOnly = true)
    public EligibilityResult validateTrio(Long categoryId, List<Long> competitorIds) {
        if (competitorIds == null || competitorIds.size() != Trio.SIZE) {
            return EligibilityResult.rejected("A trio must have exactly 3 competitors");
        }
        Category category = categoryRepository.findById(categoryId).orElse(null);
        if (category == null) {
            return EligibilityResult.rejected("Category not found");
        }
        List<Competitor> members;
        try {
            members = loadMembers(competitorIds);
        } catch (ResourceNotFoundException e) {
            return EligibilityResult.rejected(e.getMessage());
        }
        return validator.validate(category, members);
    }

    @Transactional
    public Trio createTrio(Long provaId, Long categoryId, List<Long> competitorIds, Integer trioNumber) {
        return createTrio(provaId, categoryId, competitorIds, trioNumber, true);
    }

    /**
     * Create a trio after validating its composition and the members' quotas.
     * An empty result row is created alongside so placements can be recorded later.
     *
     * @param trioNumber explicit number, or null for the next free one
     * @throws TrioValidationException when the composition breaks a category rule
     */
    @Transactional
    public Trio createTrio(Long provaId, Long categoryId, List<Long> competitorIds,
                           Integer trioNumber, boolean manualFormation) {
        if (competitorIds == null || competitorIds.size() != Trio.SIZE) {
            throw new TrioValidationException("A trio must have exactly 3 competitors");
        }
        Prova prova = provaRepository.findByIdAndDeletedAtIsNull(provaId)
                .orElseThrow(() -> new ResourceNotFoundException("Event not found: " + provaId));
        Category category = categoryRepository.findById(categoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Category not found: " + categoryId));
        List<Competitor> members = loadMembers(competitorIds);

        EligibilityResult eligibility = validator.validate(category, members);
        if (!eligibility.valid()) {
            log.warn("Trio rejected for event={} category={} members={}: {}",
                    provaId, categoryId, competitorIds, eligibility.reason());
            throw new TrioValidationException(eligibility.reason());
        }

        for (Competitor member : members) {
            checkQuota(quotaTracker.ensureQuota(member, prova, category));
        }

        int number = resolveTrioNumber(provaId, categoryId, trioNumber);
        LocalDate today = LocalDate.now(clock);

        Trio trio = Trio.builder()
                .prova(prova)
                .category(category)
                .members(new ArrayList<>(members))
                .trioNumber(number)
                .handicapTotal(members.stream().mapToInt(Competitor::getHandicap).sum())
                .ageTotal(members.stream().mapToInt(m -> m.ageAt(today)).sum())
                .manualFormation(manualFormation)
                .build();
        trio = trioRepository.save(trio);

        runResultRepository.save(RunResult.builder()
                .trio(trio)
                .prova(prova)
                .build());

        log.info("Created trio #{} id={} event={} category={} members={} handicapTotal={} ageTotal={}",
                number, trio.getId(), provaId, categoryId, competitorIds, trio.getHandicapTotal(), trio.getAgeTotal());
        return trio;
    }

    @Transactional(readOnly = true)
    public Trio getTrio(Long trioId) {
        return trioRepository.findByIdAndDeletedAtIsNull(trioId)
                .orElseThrow(() -> new ResourceNotFoundException("Trio not found: " + trioId));
    }

    @Transactional(readOnly = true)
    public List<Trio> listTrios(Long provaId, Long categoryId) {
        return trioRepository.findByProva_IdAndCategory_IdAndDeletedAtIsNullOrderByTrioNumberAsc(provaId, categoryId);
    }

    /**
     * Soft delete. A trio whose run has already been recorded cannot be removed.
     */
    @Transactional
    public void deleteTrio(Long trioId) {
        Trio trio = getTrio(trioId);
        runResultRepository.findByTrio_Id(trioId)
                .filter(RunResult::isRecorded)
                .ifPresent(r -> {
                    throw new ConsistencyException("Trio " + trioId + " already has a recorded result");
                });
        trio.setDeletedAt(Instant.now(clock));
        trioRepository.save(trio);
        log.info("Deleted trio id={} (#{})", trioId, trio.getTrioNumber());
    }

    /* ============================ Internals ============================ */

    // Keeps the caller's order; duplicated ids resolve to the same entity.
    private List<Competitor> loadMembers(List<Long> competitorIds) {
        Map<Long, Competitor> byId = competitorRepository.findByIdInAndDeletedAtIsNull(competitorIds).stream()
                .collect(Collectors.toMap(Competitor::getId, Function.identity()));
        List<Competitor> members = new ArrayList<>(competitorIds.size());
        for (Long id : competitorIds) {
            Competitor competitor = byId.get(id);
            if (competitor == null) {
                throw new ResourceNotFoundException("Competitor not found: " + id);
            }
            members.add(competitor);
        }
        return members;
    }

    private int resolveTrioNumber(Long provaId, Long categoryId, Integer requested) {
        if (requested == null) {
            return trioRepository.findMaxTrioNumber(provaId, categoryId) + 1;
        }
        if (requested < 1) {
            throw new TrioValidationException("Trio number must be positive: " + requested);
        }
        if (trioRepository.existsByProva_IdAndCategory_IdAndTrioNumber(provaId, categoryId, requested)) {
            throw new TrioValidationException("Trio number " + requested + " is already used in this category");
        }
        return requested;
    }

    private static void checkQuota(ParticipationQuota quota) {
        if (quota.getState() == QuotaState.BLOCKED) {
            throw new QuotaBlockedException(String.format("Competitor %d is blocked for this event/category: %s",
                    quota.getCompetitor().getId(), quota.getBlockReason()));
        }
        if (quota.getState() == QuotaState.EXHAUSTED) {
            throw new QuotaExhaustedException(String.format("Competitor %d has no runs left (%d of %d used)",
                    quota.getCompetitor().getId(), quota.getRunsExecuted(), quota.getMaxRunsAllowed()));
        }
    }
}
