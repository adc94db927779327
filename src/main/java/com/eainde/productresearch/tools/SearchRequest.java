package com.eainde.productresearch.tools;

import com.eainde.productresearch.model.SearchProvider;

/**
 * One search call. Model-driven backends use the system prompt and formatted input,
 * plain search APIs use the bare terms.
 */
public record SearchRequest(SearchProvider provider, String systemPrompt, String input, String terms) {
}
