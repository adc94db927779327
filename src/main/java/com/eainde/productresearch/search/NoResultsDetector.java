package com.eainde.productresearch.search;

import java.util.List;
import java.util.Locale;

/**
 * Recognizes provider answers that authoritatively report zero matches.
 */
public final class NoResultsDetector {

    static final List<String> NO_RESULTS_PHRASES = List.of(
            "no results",
            "hasn't returned any results",
            "hasn’t returned any results",
            "\"total_results\":0",
            "\"total_results\": 0",
            "\"organic_results_state\":\"fully empty\"",
            "\"organic_results_state\": \"fully empty\"",
            "your search did not match any documents",
            "did not match any documents"
    );

    private NoResultsDetector() {
    }

    public static boolean isNoResults(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String phrase : NO_RESULTS_PHRASES) {
            if (lower.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
