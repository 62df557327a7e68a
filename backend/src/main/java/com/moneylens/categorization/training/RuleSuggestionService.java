package com.moneylens.categorization.training;

import com.moneylens.categorization.rule.RuleBook;
import com.moneylens.domain.ClassificationRule;
import com.moneylens.domain.ClassificationRuleRepository;
import com.moneylens.domain.TrainingSample;
import com.moneylens.domain.TrainingSampleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives keyword rules from manual corrections. A sample's primary keyword becomes an uppercase pattern
 * unless some existing rule pattern already contains it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RuleSuggestionService {

    public static final int SUGGESTED_RULE_PRIORITY = 60;
    private static final int MIN_MANUAL_SAMPLES = 2;
    private static final int MIN_KEYWORD_LENGTH = 3;

    /** Swedish and English filler words found in bank descriptions. */
    private static final Set<String> NOISE_WORDS = Set.of(
            "och", "eller", "för", "från", "till", "med", "av", "på", "en", "ett", "den", "det",
            "the", "and", "from", "with");

    /** Lowercased raw words, diacritics kept. */
    private static final Pattern WORD = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private final TrainingSampleRepository trainingSampleRepository;
    private final ClassificationRuleRepository classificationRuleRepository;
    private final RuleBook ruleBook;

    public RuleSuggestionResult suggestRules() {
        List<TrainingSample> manual = trainingSampleRepository.findByManualTrueOrderByTimestampAsc();
        if (manual.size() < MIN_MANUAL_SAMPLES) {
            return new RuleSuggestionResult(0, List.of(), "Need at least " + MIN_MANUAL_SAMPLES
                    + " manual samples to suggest rules. Currently have " + manual.size() + ".");
        }
        List<String> knownPatterns = new ArrayList<>();
        for (ClassificationRule rule : ruleBook.rules()) {
            if (rule.getPattern() != null) {
                knownPatterns.add(rule.getPattern().toLowerCase(Locale.ROOT));
            }
        }
        Set<String> categories = new LinkedHashSet<>();
        List<ClassificationRule> created = new ArrayList<>();
        for (TrainingSample sample : manual) {
            if (sample.getCategory() == null || sample.getCategory().isBlank()) {
                continue;
            }
            categories.add(sample.getCategory());
            List<String> keywords = keywords(sample.getDescription());
            if (keywords.isEmpty()) {
                continue;
            }
            String primary = keywords.get(0);
            if (knownPatterns.stream().anyMatch(p -> p.contains(primary))) {
                continue;
            }
            ClassificationRule rule = ClassificationRule.of(primary.toUpperCase(Locale.ROOT), sample.getCategory(),
                    sample.getSubcategory(), SUGGESTED_RULE_PRIORITY);
            rule.setAiGenerated(true);
            rule.setCreatedAt(Instant.now());
            created.add(rule);
            knownPatterns.add(primary);
        }
        if (!created.isEmpty()) {
            classificationRuleRepository.saveAll(created);
            ruleBook.refresh();
        }
        log.info("Suggested {} keyword rule(s) from {} manual sample(s)", created.size(), manual.size());
        return new RuleSuggestionResult(created.size(), List.copyOf(categories),
                "Created " + created.size() + " new categorization rules.");
    }

    public long removeSuggestedRules() {
        long removed = classificationRuleRepository.deleteByAiGeneratedTrue();
        if (removed > 0) {
            ruleBook.refresh();
        }
        log.info("Removed {} suggested rule(s)", removed);
        return removed;
    }

    /**
     * Up to five significant words (3+ chars, no filler words), in order of appearance.
     */
    static List<String> keywords(String description) {
        List<String> out = new ArrayList<>();
        if (description == null) {
            return out;
        }
        Matcher m = WORD.matcher(description.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String token = m.group();
            if (token.length() >= MIN_KEYWORD_LENGTH && !NOISE_WORDS.contains(token)) {
                out.add(token);
                if (out.size() == 5) {
                    break;
                }
            }
        }
        return out;
    }
}
