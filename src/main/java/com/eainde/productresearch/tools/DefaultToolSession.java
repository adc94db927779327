package com.eainde.productresearch.tools;

import com.eainde.productresearch.model.SearchProvider;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed set of tools handed out by a {@link ToolSessionFactory}.
 */
public class DefaultToolSession implements ToolSession {

    private final Map<SearchProvider, SearchTool> searchTools;
    private final Map<ScrapeVariant, PageScrapeTool> scrapeTools;

    public DefaultToolSession(Map<SearchProvider, SearchTool> searchTools,
                              Map<ScrapeVariant, PageScrapeTool> scrapeTools) {
        this.searchTools = searchTools.isEmpty() ? new EnumMap<>(SearchProvider.class) : new EnumMap<>(searchTools);
        this.scrapeTools = scrapeTools.isEmpty() ? new EnumMap<>(ScrapeVariant.class) : new EnumMap<>(scrapeTools);
    }

    @Override
    public Optional<SearchTool> searchTool(SearchProvider provider) {
        return Optional.ofNullable(searchTools.get(provider));
    }

    @Override
    public Optional<PageScrapeTool> scrapeTool(ScrapeVariant variant) {
        return Optional.ofNullable(scrapeTools.get(variant));
    }
}
