package com.moneylens.categorization.rule;

import com.moneylens.categorization.CategoryLabel;
import com.moneylens.domain.ClassificationRule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Priority-ordered waterfall over classification rules: highest priority first, list order on ties,
 * first rule whose pattern is found (case-insensitively) in the text wins.
 * A pattern that is not a valid regular expression is matched as a plain substring.
 */
public class RuleMatcher {

    private final List<CompiledRule> rules;

    public RuleMatcher(List<ClassificationRule> rules) {
        List<ClassificationRule> ordered = new ArrayList<>(rules);
        // List.sort is stable: equal priorities keep list order
        ordered.sort(Comparator.comparingInt(ClassificationRule::getPriority).reversed());
        List<CompiledRule> compiled = new ArrayList<>(ordered.size());
        for (ClassificationRule rule : ordered) {
            if (rule.getPattern() == null || rule.getPattern().isEmpty() || rule.getCategory() == null) {
                continue;
            }
            compiled.add(CompiledRule.of(rule));
        }
        this.rules = List.copyOf(compiled);
    }

    /**
     * @return category of the first matching rule, or empty
     */
    public Optional<RuleHit> match(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (CompiledRule rule : rules) {
            if (rule.matches(text, lower)) {
                return Optional.of(new RuleHit(new CategoryLabel(rule.category(), rule.subcategory()), rule.pattern()));
            }
        }
        return Optional.empty();
    }

    public int size() {
        return rules.size();
    }

    public record RuleHit(CategoryLabel label, String pattern) {
    }

    private record CompiledRule(String pattern, Pattern regex, String literal, String category, String subcategory) {

        static CompiledRule of(ClassificationRule rule) {
            Pattern regex;
            try {
                regex = Pattern.compile(rule.getPattern(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            } catch (PatternSyntaxException e) {
                regex = null;
            }
            return new CompiledRule(rule.getPattern(), regex, rule.getPattern().toLowerCase(Locale.ROOT),
                    rule.getCategory(), rule.getSubcategory());
        }

        boolean matches(String text, String lowerText) {
            if (regex != null) {
                return regex.matcher(text).find();
            }
            return lowerText.contains(literal);
        }
    }
}
