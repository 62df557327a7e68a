package com.moneylens.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Pattern -> category rule. Pattern is a regular expression, or a plain substring when it does not compile.
 * Higher priority is evaluated first. Configured rules live in application.yml; stored rules
 * (e.g. suggested from manual corrections) live in classification_rules.
 */
@Document(collection = "classification_rules")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ClassificationRule {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String pattern;
    private String category;
    private String subcategory;
    private int priority;
    private boolean aiGenerated;
    private Instant createdAt;

    public static ClassificationRule of(String pattern, String category, String subcategory, int priority) {
        ClassificationRule r = new ClassificationRule();
        r.setPattern(pattern);
        r.setCategory(category);
        r.setSubcategory(subcategory);
        r.setPriority(priority);
        return r;
    }
}
