package com.moneylens.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Category name -> ordered subcategory names. Read-only; supplied by configuration.
 * An empty taxonomy places no restriction on labels.
 */
public final class CategoryTaxonomy {

    private static final CategoryTaxonomy EMPTY = new CategoryTaxonomy(Map.of());

    private final Map<String, List<String>> subcategoriesByCategory;

    public CategoryTaxonomy(Map<String, List<String>> subcategoriesByCategory) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (subcategoriesByCategory != null) {
            subcategoriesByCategory.forEach((k, v) -> copy.put(k, v == null ? List.of() : List.copyOf(v)));
        }
        this.subcategoriesByCategory = Collections.unmodifiableMap(copy);
    }

    public static CategoryTaxonomy empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return subcategoriesByCategory.isEmpty();
    }

    public Set<String> getCategories() {
        return subcategoriesByCategory.keySet();
    }

    public List<String> getSubcategories(String category) {
        return subcategoriesByCategory.getOrDefault(category, List.of());
    }

    /**
     * Whether a classifier may produce this category. Always true for an empty taxonomy.
     */
    public boolean allows(String category) {
        return isEmpty() || subcategoriesByCategory.containsKey(category);
    }
}
