package com.eainde.productresearch.tools;

/**
 * A search backend returning raw text, usually JSON of the form {@code {"results": [...]}}.
 */
public interface SearchTool {

    /**
     * @throws ToolException on transient failures
     * @throws ConnectionDroppedException when the underlying connection was lost
     */
    String search(SearchRequest request);
}
