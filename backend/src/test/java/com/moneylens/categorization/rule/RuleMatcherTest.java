package com.moneylens.categorization.rule;

import com.moneylens.categorization.CategoryLabel;
import com.moneylens.domain.ClassificationRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleMatcherTest {

    private final RuleMatcher matcher = new RuleMatcher(List.of(
            ClassificationRule.of("SHELL", "Transport", "Fuel", 80),
            ClassificationRule.of("ICA", "Food", "Groceries", 70),
            ClassificationRule.of("ICA BANKEN", "Banking", "Fees", 90)
    ));

    @ParameterizedTest
    @ValueSource(strings = {"SHELL TANKNING", "shell tankning", "ShElL tAnKnInG"})
    @DisplayName("matching is case-insensitive")
    void caseInsensitive(String text) {
        assertThat(matcher.match(text))
                .get()
                .extracting(RuleMatcher.RuleHit::label)
                .isEqualTo(new CategoryLabel("Transport", "Fuel"));
    }

    @Test
    @DisplayName("highest priority rule wins even when a lower one also matches")
    void priorityOrder() {
        assertThat(matcher.match("ICA BANKEN avgift").orElseThrow().label())
                .isEqualTo(new CategoryLabel("Banking", "Fees"));
        assertThat(matcher.match("ICA Maxi Solna").orElseThrow().label())
                .isEqualTo(new CategoryLabel("Food", "Groceries"));
    }

    @Test
    @DisplayName("equal priorities keep list order")
    void tiesKeepListOrder() {
        RuleMatcher tied = new RuleMatcher(List.of(
                ClassificationRule.of("coffee", "Food", "Coffee", 50),
                ClassificationRule.of("espresso", "Food", "Restaurants", 50)));

        assertThat(tied.match("Espresso House coffee").orElseThrow().label())
                .isEqualTo(new CategoryLabel("Food", "Coffee"));
    }

    @Test
    @DisplayName("invalid regex falls back to substring for that rule only")
    void malformedPatternFallsBackToSubstring() {
        RuleMatcher withBadPattern = new RuleMatcher(List.of(
                ClassificationRule.of("C++ (books", "Education", "Books", 60),
                ClassificationRule.of("^AMZN", "Shopping", "Online", 50)));

        assertThat(withBadPattern.match("Bokus c++ (books order").orElseThrow().label())
                .isEqualTo(new CategoryLabel("Education", "Books"));
        assertThat(withBadPattern.match("amzn mktp se").orElseThrow().label())
                .isEqualTo(new CategoryLabel("Shopping", "Online"));
        assertThat(withBadPattern.match("C++ manual")).isEmpty();
    }

    @Test
    @DisplayName("rules without pattern or category are ignored; blank text matches nothing")
    void incompleteRulesIgnored() {
        RuleMatcher m = new RuleMatcher(List.of(
                ClassificationRule.of("", "Other", null, 100),
                ClassificationRule.of("rent", null, null, 100),
                ClassificationRule.of("hyra", "Housing", "Rent", 10)));

        assertThat(m.size()).isEqualTo(1);
        assertThat(m.match("rent march")).isEmpty();
        assertThat(m.match("")).isEmpty();
        assertThat(m.match(null)).isEmpty();
        assertThat(m.match("Hyra mars").orElseThrow().pattern()).isEqualTo("hyra");
    }
}
