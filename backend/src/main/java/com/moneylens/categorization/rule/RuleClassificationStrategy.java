package com.moneylens.categorization.rule;

import com.moneylens.categorization.pipeline.ClassificationStrategy;
import com.moneylens.categorization.pipeline.StrategyMatch;
import com.moneylens.domain.ClassificationSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Rule hits are deterministic: score 1.0.
 */
@Component
@RequiredArgsConstructor
public class RuleClassificationStrategy implements ClassificationStrategy {

    private final RuleBook ruleBook;

    @Override
    public ClassificationSource source() {
        return ClassificationSource.RULE;
    }

    @Override
    public Optional<StrategyMatch> tryClassify(String text) {
        return ruleBook.matcher().match(text)
                .map(hit -> new StrategyMatch(hit.label(), 1.0, hit.pattern()));
    }
}
