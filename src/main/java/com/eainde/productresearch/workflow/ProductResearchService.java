package com.eainde.productresearch.workflow;

import com.eainde.productresearch.model.FinalResult;
import com.eainde.productresearch.model.ProductQuery;
import com.eainde.productresearch.nodes.FinalizeNode;
import com.eainde.productresearch.state.ProductResearchState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for researching a single product.
 * <p>
 * Runs the compiled research graph with the product's identifiers as input and returns the
 * finalized result. The product key is put in the MDC for the duration of the run so every
 * log line of the run, including those written on worker threads, can be attributed to it.
 * </p>
 */
@Log4j2
@Service
public class ProductResearchService {

    public static final String MDC_PRODUCT_KEY = "productKey";

    private final CompiledGraph<ProductResearchState> workflow;

    public ProductResearchService(@Qualifier(ProductResearchGraph.BEAN_NAME) CompiledGraph<ProductResearchState> workflow) {
        this.workflow = workflow;
    }

    /**
     * Researches one product.
     *
     * @param query identifiers of the product; absent fields are empty strings
     * @return the finalized result, possibly with no validated pages
     * @throws ResearchException if the graph itself fails to run
     */
    public FinalResult runSingle(ProductQuery query) {
        String previousKey = MDC.get(MDC_PRODUCT_KEY);
        MDC.put(MDC_PRODUCT_KEY, query.key());
        try {
            Map<String, Object> inputs = new HashMap<>();
            inputs.put(ProductResearchState.BARCODE, query.barcode());
            inputs.put(ProductResearchState.SKU, query.sku());
            inputs.put(ProductResearchState.TITLE, query.title());

            log.info("Starting research for barcode='{}' sku='{}' title='{}'",
                    query.barcode(), query.sku(), query.title());

            Optional<ProductResearchState> finalState;
            try {
                finalState = workflow.invoke(inputs);
            } catch (Exception e) {
                throw new ResearchException("Research graph failed for " + query.key(), e);
            }

            ProductResearchState state = finalState
                    .orElseThrow(() -> new ResearchException("Research graph produced no state for " + query.key()));
            return state.finalResult().orElseGet(() -> FinalizeNode.assemble(state));
        } finally {
            if (previousKey != null) {
                MDC.put(MDC_PRODUCT_KEY, previousKey);
            } else {
                MDC.remove(MDC_PRODUCT_KEY);
            }
        }
    }
}
