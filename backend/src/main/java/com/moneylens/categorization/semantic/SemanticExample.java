package com.moneylens.categorization.semantic;

import com.moneylens.categorization.CategoryLabel;

/**
 * Reference phrase for a label with its precomputed embedding.
 */
record SemanticExample(CategoryLabel label, String phrase, double[] embedding) {
}
