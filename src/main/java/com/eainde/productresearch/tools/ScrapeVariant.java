package com.eainde.productresearch.tools;

/**
 * Page-scrape flavours. Marketplace pages need browser-like requests to be served.
 */
public enum ScrapeVariant {
    MARKETPLACE,
    GENERIC
}
