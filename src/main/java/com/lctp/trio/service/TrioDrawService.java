package com.lctp.trio.service;

import com.lctp.trio.engine.CategoryRuleSet;
import com.lctp.trio.engine.TrioEligibilityValidator;
import com.lctp.trio.entity.Category;
import com.lctp.trio.entity.Competitor;
import com.lctp.trio.entity.ParticipationQuota;
import com.lctp.trio.entity.RunConfiguration;
import com.lctp.trio.entity.Trio;
import com.lctp.trio.enums.DrawMode;
import com.lctp.trio.exception.DrawException;
import com.lctp.trio.exception.ResourceNotFoundException;
import com.lctp.trio.model.DrawResult;
import com.lctp.trio.model.RuleSet;
import com.lctp.trio.repository.CategoryRepository;
import com.lctp.trio.repository.CompetitorRepository;
import com.lctp.trio.repository.RunConfigurationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Random formation of trios from a pool of competitors.
 * The whole draw runs in one transaction: if any trio is rejected nothing is saved.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TrioDrawService {

    static final int MAX_OPEN_DRAW_ATTEMPTS = 1000;

    private final TrioService trioService;
    private final ParticipationQuotaTracker quotaTracker;
    private final CategoryRepository categoryRepository;
    private final CompetitorRepository competitorRepository;
    private final RunConfigurationRepository runConfigurationRepository;
    private final CategoryRuleSet categoryRuleSet;
    private final TrioEligibilityValidator validator;
    private final Random random;
    private final Clock clock;

    /**
     * Draw trios for an event/category. Competitors whose quota is blocked or used up are
     * left out before drawing. When the active run configuration allows more than one run
     * per competitor the multi-run rotation replaces the category's own draw mode.
     */
    @Transactional
    public DrawResult draw(Long provaId, Long categoryId, List<Long> competitorIds) {
        Category category = categoryRepository.findById(categoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Category not found: " + categoryId));
        RuleSet rules = categoryRuleSet.rulesFor(category.getType());
        if (!rules.isDrawAllowed()) {
            throw new DrawException("Draw is not allowed for category " + category.getType());
        }

        List<Long> requested = competitorIds == null ? List.of() : new ArrayList<>(new LinkedHashSet<>(competitorIds));
        Map<Long, Integer> remainingRuns = new LinkedHashMap<>();
        List<Long> ineligible = new ArrayList<>();
        for (Long competitorId : requested) {
            Optional<ParticipationQuota> quota = quotaTracker.find(competitorId, provaId, categoryId);
            if (quota.isPresent() && !quota.get().canCompete()) {
                ineligible.add(competitorId);
            } else {
                remainingRuns.put(competitorId, quota.map(ParticipationQuota::getRunsRemaining).orElse(Integer.MAX_VALUE));
            }
        }
        if (!ineligible.isEmpty()) {
            log.info("Left out of the draw for event={} category={}, blocked or out of runs: {}",
                    provaId, categoryId, ineligible);
        }

        List<Long> pool = new ArrayList<>(remainingRuns.keySet());
        if (pool.size() < rules.getMinDrawPool()) {
            throw new DrawException(String.format("Not enough competitors for a draw: %d, minimum is %d",
                    pool.size(), rules.getMinDrawPool()));
        }

        int runsPerCompetitor = runConfigurationRepository.findByProva_IdAndCategory_IdAndActiveTrue(provaId, categoryId)
                .map(RunConfiguration::getMaxRunsPerCompetitor)
                .orElse(1);
        DrawMode mode = runsPerCompetitor > 1 ? DrawMode.MULTI_RUN : rules.getDrawMode();

        List<List<Long>> groups = switch (mode) {
            case FULL -> fullDraw(pool);
            case PARTIAL -> partialDraw(pool, rules);
            case AGE_RESTRICTED -> ageRestrictedDraw(pool, rules);
            case OPEN -> openDraw(pool, category);
            case MULTI_RUN -> multiRunDraw(pool, category, slots(remainingRuns, runsPerCompetitor));
            case NONE -> throw new DrawException("Draw is not allowed for category " + category.getType());
        };

        List<Trio> trios = new ArrayList<>(groups.size());
        Set<Long> drawn = new LinkedHashSet<>();
        for (List<Long> group : groups) {
            trios.add(trioService.createTrio(provaId, categoryId, group, null, false));
            drawn.addAll(group);
        }
        List<Long> notDrawn = requested.stream().filter(id -> !drawn.contains(id)).toList();

        log.info("{} draw for event={} category={}: {} trio(s), {} competitor(s) left out",
                mode, provaId, categoryId, trios.size(), notDrawn.size());
        return new DrawResult(mode, trios, List.copyOf(drawn), notDrawn, ineligible);
    }

    /* ============================ Draw modes ============================ */

    // Everyone is shuffled into consecutive groups; a remainder of 1 or 2 is left out.
    List<List<Long>> fullDraw(List<Long> pool) {
        List<Long> shuffled = new ArrayList<>(pool);
        Collections.shuffle(shuffled, random);
        return chunk(shuffled);
    }

    // Samples between the pool bounds, rounded down to whole trios.
    List<List<Long>> partialDraw(List<Long> pool, RuleSet rules) {
        int max = rules.getMaxDrawPool() != null ? rules.getMaxDrawPool() : pool.size();
        int n = Math.max(rules.getMinDrawPool(), Math.min(max, pool.size()));
        n = Math.min(n, pool.size());
        n -= n % Trio.SIZE;
        if (n == 0) {
            throw new DrawException("Not enough competitors for a draw: " + pool.size());
        }
        List<Long> shuffled = new ArrayList<>(pool);
        Collections.shuffle(shuffled, random);
        return chunk(shuffled.subList(0, n));
    }

    // Youngest first, repeatedly takes the first combination within the combined age limit.
    List<List<Long>> ageRestrictedDraw(List<Long> pool, RuleSet rules) {
        LocalDate today = LocalDate.now(clock);
        List<Competitor> competitors = loadPool(pool);
        List<String> missingBirthDate = competitors.stream()
                .filter(c -> c.getBirthDate() == null)
                .map(c -> c.getName() + " #" + c.getId())
                .toList();
        if (!missingBirthDate.isEmpty()) {
            throw new DrawException("Missing birth date for " + String.join(", ", missingBirthDate));
        }

        List<Competitor> available = new ArrayList<>(competitors);
        available.sort(Comparator.comparingInt((Competitor c) -> c.ageAt(today)).thenComparing(Competitor::getId));
        int maxCombinedAge = rules.getMaxCombinedAge() != null ? rules.getMaxCombinedAge() : Integer.MAX_VALUE;

        List<List<Long>> groups = new ArrayList<>();
        List<Competitor> combination;
        while ((combination = firstCombinationWithin(available, maxCombinedAge, today)) != null) {
            groups.add(combination.stream().map(Competitor::getId).toList());
            available.removeAll(combination);
        }
        return groups;
    }

    // Shuffled candidates are validated; a rejected candidate reshuffles the rest.
    List<List<Long>> openDraw(List<Long> pool, Category category) {
        Map<Long, Competitor> byId = loadPool(pool).stream()
                .collect(Collectors.toMap(Competitor::getId, Function.identity()));
        List<Long> remaining = new ArrayList<>(pool);
        Collections.shuffle(remaining, random);

        List<List<Long>> groups = new ArrayList<>();
        int attempts = 0;
        while (remaining.size() >= Trio.SIZE && attempts < MAX_OPEN_DRAW_ATTEMPTS) {
            List<Long> candidate = List.copyOf(remaining.subList(0, Trio.SIZE));
            List<Competitor> members = candidate.stream().map(byId::get).toList();
            if (validator.validate(category, members).valid()) {
                groups.add(candidate);
                remaining.subList(0, Trio.SIZE).clear();
            } else {
                Collections.shuffle(remaining, random);
                attempts++;
            }
        }
        return groups;
    }

    // Each competitor joins up to its slot count; whoever has played least goes first.
    // No two trios share the same three members.
    List<List<Long>> multiRunDraw(List<Long> pool, Category category, Map<Long, Integer> slots) {
        Map<Long, Competitor> byId = loadPool(pool).stream()
                .collect(Collectors.toMap(Competitor::getId, Function.identity()));
        List<Long> queue = new ArrayList<>(pool);
        Collections.shuffle(queue, random);
        Map<Long, Integer> played = new HashMap<>();
        queue.forEach(id -> played.put(id, 0));

        Set<Set<Long>> formed = new HashSet<>();
        List<List<Long>> groups = new ArrayList<>();
        List<Long> candidate;
        do {
            List<Long> eligible = queue.stream()
                    .filter(id -> played.get(id) < slots.get(id))
                    .sorted(Comparator.comparing(played::get))
                    .toList();
            candidate = firstNewCombination(eligible, formed,
                    ids -> validator.validate(category, ids.stream().map(byId::get).toList()).valid());
            if (candidate != null) {
                groups.add(candidate);
                formed.add(Set.copyOf(candidate));
                candidate.forEach(id -> played.merge(id, 1, Integer::sum));
            }
        } while (candidate != null);

        log.debug("Multi-run draw participations: {}", played);
        return groups;
    }

    /* ============================ Internals ============================ */

    private static Map<Long, Integer> slots(Map<Long, Integer> remainingRuns, int runsPerCompetitor) {
        Map<Long, Integer> slots = new HashMap<>();
        remainingRuns.forEach((id, remaining) -> slots.put(id, Math.min(remaining, runsPerCompetitor)));
        return slots;
    }

    private static List<Long> firstNewCombination(List<Long> ordered, Set<Set<Long>> formed,
                                                  Predicate<List<Long>> acceptable) {
        int size = ordered.size();
        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                for (int k = j + 1; k < size; k++) {
                    List<Long> ids = List.of(ordered.get(i), ordered.get(j), ordered.get(k));
                    if (!formed.contains(Set.copyOf(ids)) && acceptable.test(ids)) {
                        return ids;
                    }
                }
            }
        }
        return null;
    }

    private static List<Competitor> firstCombinationWithin(List<Competitor> sorted, int maxCombinedAge, LocalDate today) {
        int size = sorted.size();
        for (int i = 0; i < size; i++) {
            int ageI = sorted.get(i).ageAt(today);
            for (int j = i + 1; j < size; j++) {
                int ageJ = sorted.get(j).ageAt(today);
                for (int k = j + 1; k < size; k++) {
                    if (ageI + ageJ + sorted.get(k).ageAt(today) <= maxCombinedAge) {
                        return List.of(sorted.get(i), sorted.get(j), sorted.get(k));
                    }
                }
            }
        }
        return null;
    }

    private List<Competitor> loadPool(List<Long> pool) {
        List<Competitor> competitors = competitorRepository.findByIdInAndDeletedAtIsNull(pool);
        if (competitors.size() != pool.size()) {
            List<Long> found = competitors.stream().map(Competitor::getId).toList();
            List<Long> missing = pool.stream().filter(id -> !found.contains(id)).toList();
            throw new ResourceNotFoundException("Competitors not found: " + missing);
        }
        return competitors;
    }

    private static List<List<Long>> chunk(List<Long> ids) {
        List<List<Long>> groups = new ArrayList<>();
        for (int i = 0; i + Trio.SIZE <= ids.size(); i += Trio.SIZE) {
            groups.add(List.copyOf(ids.subList(i, i + Trio.SIZE)));
        }
        return groups;
    }
}
