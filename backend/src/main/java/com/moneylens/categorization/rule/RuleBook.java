package com.moneylens.categorization.rule;

import com.moneylens.categorization.config.CategorizationProperties;
import com.moneylens.domain.ClassificationRule;
import com.moneylens.domain.ClassificationRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Current rule set: configured rules (application.yml order) followed by stored rules (creation order).
 * Built on first use and rebuilt by {@link #refresh()} after stored rules change.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RuleBook {

    private final CategorizationProperties properties;
    private final ClassificationRuleRepository classificationRuleRepository;

    private volatile RuleMatcher matcher;

    public RuleMatcher matcher() {
        RuleMatcher m = matcher;
        if (m == null) {
            m = refresh();
        }
        return m;
    }

    /** All rules in list order (before priority sorting). */
    public List<ClassificationRule> rules() {
        List<ClassificationRule> all = new ArrayList<>();
        for (CategorizationProperties.RuleDefinition def : properties.getRules()) {
            all.add(ClassificationRule.of(def.getPattern(), def.getCategory(), def.getSubcategory(), def.getPriority()));
        }
        all.addAll(classificationRuleRepository.findAllByOrderByCreatedAtAsc());
        return all;
    }

    public synchronized RuleMatcher refresh() {
        RuleMatcher m = new RuleMatcher(rules());
        matcher = m;
        log.info("Rule book loaded: {} rule(s)", m.size());
        return m;
    }
}
