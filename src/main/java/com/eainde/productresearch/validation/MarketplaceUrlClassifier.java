package com.eainde.productresearch.validation;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Recognizes Amazon storefront URLs, which need the marketplace scrape variant.
 * Any subdomain matches; the scheme is optional.
 */
public final class MarketplaceUrlClassifier {

    static final List<String> AMAZON_DOMAINS = List.of(
            "amazon.com", "amazon.ca", "amazon.com.mx", "amazon.com.br",
            "amazon.co.uk", "amazon.de", "amazon.fr", "amazon.it", "amazon.es",
            "amazon.nl", "amazon.pl", "amazon.se", "amazon.com.be", "amazon.ie",
            "amazon.in", "amazon.co.jp", "amazon.cn", "amazon.sg", "amazon.sa",
            "amazon.ae", "amazon.com.tr", "amazon.eg", "amazon.co.za", "amazon.com.au");

    private MarketplaceUrlClassifier() {
    }

    public static boolean isMarketplace(String url) {
        String host = hostOf(url);
        if (host.isEmpty()) {
            return false;
        }
        for (String domain : AMAZON_DOMAINS) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    /** Lower-cased host without port; for scheme-less input the first path segment. */
    static String hostOf(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String trimmed = url.trim();
        String host = null;
        if (trimmed.contains("://")) {
            try {
                host = URI.create(trimmed).getHost();
            } catch (IllegalArgumentException e) {
                host = null;
            }
            if (host == null) {
                String rest = trimmed.substring(trimmed.indexOf("://") + 3);
                host = firstSegment(rest);
            }
        } else {
            host = firstSegment(trimmed);
        }
        int at = host.lastIndexOf('@');
        if (at >= 0) {
            host = host.substring(at + 1);
        }
        int colon = host.indexOf(':');
        if (colon >= 0) {
            host = host.substring(0, colon);
        }
        host = host.toLowerCase(Locale.ROOT);
        while (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        return host;
    }

    private static String firstSegment(String text) {
        int end = text.length();
        for (char stop : new char[]{'/', '?', '#'}) {
            int index = text.indexOf(stop);
            if (index >= 0 && index < end) {
                end = index;
            }
        }
        return text.substring(0, end);
    }
}
