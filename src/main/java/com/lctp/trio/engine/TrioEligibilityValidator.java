package com.lctp.trio.engine;

import com.lctp.trio.entity.Category;
import com.lctp.trio.entity.Competitor;
import com.lctp.trio.model.EligibilityResult;
import com.lctp.trio.model.RuleSet;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks whether three competitors may form a trio in a category.
 * Read-only: the same check backs both trio creation and the dry-run validation.
 */
@Component
@RequiredArgsConstructor
public class TrioEligibilityValidator {

    private final CategoryRuleSet categoryRuleSet;
    private final Clock clock;

    public EligibilityResult validate(Category category, Competitor a, Competitor b, Competitor c) {
        return validate(category, a, b, c, LocalDate.now(clock));
    }

    /**
     * Rules are evaluated in a fixed order and the first failure is reported.
     *
     * @param asOf date used to compute each member's age
     */
    public EligibilityResult validate(Category category, Competitor a, Competitor b, Competitor c, LocalDate asOf) {
        if (category == null) {
            return EligibilityResult.rejected("Category not found");
        }
        if (a == null || b == null || c == null) {
            return EligibilityResult.rejected("A trio must have exactly 3 competitors");
        }

        List<Competitor> members = sortedById(a, b, c);

        if (!allDistinct(members)) {
            return EligibilityResult.rejected("A competitor cannot appear twice in the same trio");
        }

        EligibilityResult dataCheck = checkMemberData(members);
        if (!dataCheck.valid()) {
            return dataCheck;
        }

        RuleSet rules = categoryRuleSet.rulesFor(category.getType());
        if (rules.isUnrestricted()) {
            return EligibilityResult.ok();
        }

        List<Integer> ages = members.stream().map(m -> m.ageAt(asOf)).toList();

        if (rules.hasIndividualAgeBound()) {
            List<String> outside = new ArrayList<>();
            for (int i = 0; i < members.size(); i++) {
                if (!rules.acceptsAge(ages.get(i))) {
                    outside.add(label(members.get(i)) + " (" + ages.get(i) + ")");
                }
            }
            if (!outside.isEmpty()) {
                return EligibilityResult.rejected(String.format(
                        "Individual age outside the %s bound (%s) for %s",
                        rules.getType(), rules.describeAgeBound(), String.join(", ", outside)));
            }
        }

        if (rules.getMaxCombinedAge() != null) {
            int ageTotal = ages.stream().mapToInt(Integer::intValue).sum();
            if (ageTotal > rules.getMaxCombinedAge()) {
                return EligibilityResult.rejected(String.format(
                        "Combined age exceeds limit: %d > %d", ageTotal, rules.getMaxCombinedAge()));
            }
        }

        if (rules.getMaxCombinedHandicap() != null) {
            int handicapTotal = members.stream().mapToInt(Competitor::getHandicap).sum();
            if (handicapTotal > rules.getMaxCombinedHandicap()) {
                return EligibilityResult.rejected(String.format(
                        "Combined handicap exceeds limit: %d > %d", handicapTotal, rules.getMaxCombinedHandicap()));
            }
        }

        if (rules.getRequiredSex() != null) {
            String mismatched = members.stream()
                    .filter(m -> m.getSex() != rules.getRequiredSex())
                    .map(TrioEligibilityValidator::label)
                    .collect(Collectors.joining(", "));
            if (!mismatched.isEmpty()) {
                return EligibilityResult.rejected(String.format(
                        "Category %s requires all members to be %s: %s",
                        rules.getType(), rules.getRequiredSex(), mismatched));
            }
        }

        return EligibilityResult.ok();
    }

    public EligibilityResult validate(Category category, List<Competitor> competitors) {
        if (competitors == null || competitors.size() != 3) {
            return EligibilityResult.rejected("A trio must have exactly 3 competitors");
        }
        return validate(category, competitors.get(0), competitors.get(1), competitors.get(2));
    }

    /* ============================ Internals ============================ */

    private static List<Competitor> sortedById(Competitor a, Competitor b, Competitor c) {
        List<Competitor> members = new ArrayList<>(List.of(a, b, c));
        members.sort(Comparator.comparing(Competitor::getId, Comparator.nullsLast(Comparator.naturalOrder())));
        return members;
    }

    private static boolean allDistinct(List<Competitor> members) {
        Set<Object> keys = new HashSet<>();
        for (Competitor m : members) {
            Object key = m.getId() != null ? m.getId() : m;
            if (!keys.add(key)) {
                return false;
            }
        }
        return true;
    }

    private static EligibilityResult checkMemberData(List<Competitor> members) {
        for (Competitor m : members) {
            if (!m.hasValidHandicap()) {
                return EligibilityResult.rejected(String.format(
                        "Invalid handicap %s for %s, must be between %d and %d",
                        m.getHandicap(), label(m), Competitor.MIN_HANDICAP, Competitor.MAX_HANDICAP));
            }
            if (m.getBirthDate() == null) {
                return EligibilityResult.rejected("Missing birth date for " + label(m));
            }
        }
        return EligibilityResult.ok();
    }

    private static String label(Competitor competitor) {
        if (competitor.getName() != null && !competitor.getName().isBlank()) {
            return competitor.getName() + " #" + Objects.toString(competitor.getId(), "?");
        }
        return "competitor #" + Objects.toString(competitor.getId(), "?");
    }
}
