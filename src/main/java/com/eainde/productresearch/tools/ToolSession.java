package com.eainde.productresearch.tools;

import com.eainde.productresearch.model.SearchProvider;

import java.util.Optional;

/**
 * A connected set of tools shared by all runs until it is invalidated.
 */
public interface ToolSession extends AutoCloseable {

    Optional<SearchTool> searchTool(SearchProvider provider);

    Optional<PageScrapeTool> scrapeTool(ScrapeVariant variant);

    @Override
    default void close() {
    }
}
