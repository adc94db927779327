package com.eainde.productresearch.edges;

import com.eainde.productresearch.state.ProductResearchState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Stops the loop as soon as any image was found or the plan is exhausted.
 */
@Log4j2
@Component
public class ContinueSearchEdge implements AsyncEdgeAction<ProductResearchState> {

    public static final String CONTINUE = "continue";
    public static final String DONE = "done";

    @Override
    public CompletableFuture<String> apply(ProductResearchState state) {
        return CompletableFuture.completedFuture(decide(state));
    }

    static String decide(ProductResearchState state) {
        if (state.totalValidatedImages() >= 1) {
            log.info("[continue] {} images found, stopping", state.totalValidatedImages());
            return DONE;
        }
        if (state.planExhausted()) {
            log.info("[continue] all {} attempts tried, stopping", state.searchIndex());
            return DONE;
        }
        return CONTINUE;
    }
}
