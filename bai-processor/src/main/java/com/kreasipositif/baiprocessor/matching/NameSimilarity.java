package com.kreasipositif.baiprocessor.matching;

import me.xdrop.fuzzywuzzy.FuzzySearch;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Case-insensitive token-set similarity between a bank memo and a customer name, 0–100.
 *
 * <p>Both sides are reduced to sets of words, so word order and extra words on either side
 * (e.g. {@code "ACH PAYMENT ACME CORP 0042"} against {@code "Acme Corp"}) do not lower the score.
 * Texts that share no word at all score 0.
 */
public final class NameSimilarity {

    private NameSimilarity() {
    }

    public static int tokenSetRatio(String left, String right) {
        if (left == null || right == null) {
            return 0;
        }
        Set<String> leftTokens = tokens(left);
        Set<String> rightTokens = tokens(right);
        if (leftTokens.isEmpty() || rightTokens.isEmpty()
                || leftTokens.stream().noneMatch(rightTokens::contains)) {
            return 0;
        }
        return FuzzySearch.tokenSetRatio(left, right);
    }

    // same normalisation FuzzySearch applies before splitting into tokens
    static Set<String> tokens(String text) {
        String normalised = text.toLowerCase(Locale.ROOT).replaceAll("(?U)\\W+", " ").trim();
        if (normalised.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(normalised.split("\\s+")).collect(Collectors.toSet());
    }
}
