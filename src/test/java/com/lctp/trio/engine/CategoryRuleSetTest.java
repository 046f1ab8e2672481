package com.lctp.trio.engine;

import com.lctp.trio.enums.CategoryType;
import com.lctp.trio.enums.DrawMode;
import com.lctp.trio.enums.Sex;
import com.lctp.trio.exception.UnknownCategoryTypeException;
import com.lctp.trio.model.RuleSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CategoryRuleSetTest {

    private final CategoryRuleSet ruleSet = CategoryRuleSet.standard();

    @ParameterizedTest
    @EnumSource(CategoryType.class)
    void everyTypeHasExactlyOneRuleSet(CategoryType type) {
        RuleSet rules = ruleSet.rulesFor(type);
        assertThat(rules).isNotNull();
        assertThat(rules.getType()).isEqualTo(type);
        assertThat(ruleSet.asMap()).hasSize(CategoryType.values().length);
    }

    @Test
    void standardValues() {
        assertThat(ruleSet.rulesFor(CategoryType.BABY).getMaxIndividualAge()).isEqualTo(12);
        assertThat(ruleSet.rulesFor(CategoryType.BABY).getDrawMode()).isEqualTo(DrawMode.FULL);

        RuleSet kids = ruleSet.rulesFor(CategoryType.KIDS);
        assertThat(kids.getMinIndividualAge()).isEqualTo(13);
        assertThat(kids.getMaxIndividualAge()).isEqualTo(17);
        assertThat(kids.getMinDrawPool()).isEqualTo(3);
        assertThat(kids.getMaxDrawPool()).isEqualTo(9);

        assertThat(ruleSet.rulesFor(CategoryType.MIRIM).getMaxCombinedAge()).isEqualTo(36);
        assertThat(ruleSet.rulesFor(CategoryType.FEMININA).getRequiredSex()).isEqualTo(Sex.F);
        assertThat(ruleSet.rulesFor(CategoryType.ABERTA).isUnrestricted()).isTrue();
        assertThat(ruleSet.rulesFor(CategoryType.SOMA11).getMaxCombinedHandicap()).isEqualTo(11);
    }

    @Test
    void soma11DoesNotAllowDraw() {
        assertThat(ruleSet.rulesFor(CategoryType.SOMA11).isDrawAllowed()).isFalse();
        assertThat(ruleSet.rulesFor(CategoryType.ABERTA).isDrawAllowed()).isTrue();
    }

    @Test
    void rulesForName_isCaseInsensitive_andMapsLegacyHandicap() {
        assertThat(ruleSet.rulesFor("feminina").getType()).isEqualTo(CategoryType.FEMININA);
        assertThat(ruleSet.rulesFor("handicap").getType()).isEqualTo(CategoryType.SOMA11);
    }

    @ParameterizedTest
    @ValueSource(strings = {"senior", "", "  "})
    void rulesForName_unknown_throws(String name) {
        assertThatThrownBy(() -> ruleSet.rulesFor(name))
                .isInstanceOf(UnknownCategoryTypeException.class)
                .hasMessageContaining("Unknown category type");
    }

    @Test
    void rulesForNullType_throws() {
        assertThatThrownBy(() -> ruleSet.rulesFor((CategoryType) null))
                .isInstanceOf(UnknownCategoryTypeException.class);
    }
}
