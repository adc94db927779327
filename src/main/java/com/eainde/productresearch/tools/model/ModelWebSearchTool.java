package com.eainde.productresearch.tools.model;

import com.eainde.productresearch.tools.LanguageModelClient;
import com.eainde.productresearch.tools.SearchRequest;
import com.eainde.productresearch.tools.SearchTool;

/**
 * Search performed by a web-search capable model following the search prompt.
 */
public class ModelWebSearchTool implements SearchTool {

    private final LanguageModelClient webSearchModel;

    public ModelWebSearchTool(LanguageModelClient webSearchModel) {
        this.webSearchModel = webSearchModel;
    }

    @Override
    public String search(SearchRequest request) {
        return webSearchModel.complete(request.systemPrompt(), request.input());
    }
}
