package com.eainde.productresearch.nodes;

import com.eainde.productresearch.state.ProductResearchState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Junction in front of the search nodes; routing happens on its outgoing edge.
 */
@Log4j2
@Component
public class DispatchNode implements AsyncNodeAction<ProductResearchState> {

    public static final String NAME = "dispatch";

    @Override
    public CompletableFuture<Map<String, Object>> apply(ProductResearchState state) {
        log.debug("[dispatch] index {}, attempt {}", state.searchIndex(), state.currentAttempt().orElse(null));
        return CompletableFuture.completedFuture(Map.of());
    }
}
