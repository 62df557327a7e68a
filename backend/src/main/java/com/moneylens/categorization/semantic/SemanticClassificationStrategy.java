package com.moneylens.categorization.semantic;

import com.moneylens.categorization.CategoryLabel;
import com.moneylens.categorization.pipeline.ClassificationStrategy;
import com.moneylens.categorization.pipeline.StrategyMatch;
import com.moneylens.domain.ClassificationSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Semantic matcher as a pipeline strategy. Detail = closest reference phrase.
 */
@Component
@RequiredArgsConstructor
public class SemanticClassificationStrategy implements ClassificationStrategy {

    private final SemanticMatcher semanticMatcher;

    @Override
    public ClassificationSource source() {
        return ClassificationSource.SEMANTIC;
    }

    @Override
    public Optional<StrategyMatch> tryClassify(String text) {
        return semanticMatcher.match(text)
                .map(m -> new StrategyMatch(new CategoryLabel(m.category(), m.subcategory()),
                        m.similarityScore(), m.bestExample()));
    }
}
