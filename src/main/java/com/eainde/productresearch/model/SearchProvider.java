package com.eainde.productresearch.model;

/**
 * Backends a search attempt can run against.
 */
public enum SearchProvider {
    GOOGLE,
    YAHOO,
    LLM_WEB_SEARCH
}
