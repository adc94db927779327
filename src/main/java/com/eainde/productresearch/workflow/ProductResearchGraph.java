package com.eainde.productresearch.workflow;

import com.eainde.productresearch.config.ResearchProperties;
import com.eainde.productresearch.edges.ContinueSearchEdge;
import com.eainde.productresearch.edges.SearchDispatchEdge;
import com.eainde.productresearch.nodes.AllFieldsSearchNode;
import com.eainde.productresearch.nodes.DispatchNode;
import com.eainde.productresearch.nodes.FilterNode;
import com.eainde.productresearch.nodes.FinalizeNode;
import com.eainde.productresearch.nodes.ImageUrlsCleanupNode;
import com.eainde.productresearch.nodes.InitializeNode;
import com.eainde.productresearch.nodes.SearchNode;
import com.eainde.productresearch.nodes.ValidateNode;
import com.eainde.productresearch.state.ProductResearchState;
import lombok.RequiredArgsConstructor;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Wires the research loop:
 * <pre>
 * START -> initialize -> dispatch
 * dispatch:           free_text  -> search -> filter -> validate
 *                     all_fields -> search_all_fields
 *                     done       -> image_cleanup
 * validate,
 * search_all_fields:  continue   -> dispatch
 *                     done       -> image_cleanup
 * image_cleanup -> finalize -> END
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class ProductResearchGraph {

    public static final String BEAN_NAME = "productResearchWorkflow";

    private final InitializeNode initializeNode;
    private final DispatchNode dispatchNode;
    private final SearchNode searchNode;
    private final AllFieldsSearchNode allFieldsSearchNode;
    private final FilterNode filterNode;
    private final ValidateNode validateNode;
    private final ImageUrlsCleanupNode imageCleanupNode;
    private final FinalizeNode finalizeNode;
    private final SearchDispatchEdge dispatchEdge;
    private final ContinueSearchEdge continueEdge;
    private final ResearchProperties properties;

    @Bean(BEAN_NAME)
    public CompiledGraph<ProductResearchState> build() throws GraphStateException {
        StateGraph<ProductResearchState> workflow = new StateGraph<>(ProductResearchState.SCHEMA, ProductResearchState::new);

        workflow.addNode(InitializeNode.NAME, initializeNode);
        workflow.addNode(DispatchNode.NAME, dispatchNode);
        workflow.addNode(SearchNode.NAME, searchNode);
        workflow.addNode(AllFieldsSearchNode.NAME, allFieldsSearchNode);
        workflow.addNode(FilterNode.NAME, filterNode);
        workflow.addNode(ValidateNode.NAME, validateNode);
        workflow.addNode(ImageUrlsCleanupNode.NAME, imageCleanupNode);
        workflow.addNode(FinalizeNode.NAME, finalizeNode);

        workflow.addEdge(START, InitializeNode.NAME);
        workflow.addEdge(InitializeNode.NAME, DispatchNode.NAME);

        workflow.addConditionalEdges(
                DispatchNode.NAME,
                dispatchEdge,
                Map.of(
                        SearchDispatchEdge.FREE_TEXT, SearchNode.NAME,
                        SearchDispatchEdge.ALL_FIELDS, AllFieldsSearchNode.NAME,
                        SearchDispatchEdge.DONE, ImageUrlsCleanupNode.NAME
                )
        );

        workflow.addEdge(SearchNode.NAME, FilterNode.NAME);
        workflow.addEdge(FilterNode.NAME, ValidateNode.NAME);

        Map<String, String> continuation = Map.of(
                ContinueSearchEdge.CONTINUE, DispatchNode.NAME,
                ContinueSearchEdge.DONE, ImageUrlsCleanupNode.NAME
        );
        workflow.addConditionalEdges(ValidateNode.NAME, continueEdge, continuation);
        workflow.addConditionalEdges(AllFieldsSearchNode.NAME, continueEdge, continuation);

        workflow.addEdge(ImageUrlsCleanupNode.NAME, FinalizeNode.NAME);
        workflow.addEdge(FinalizeNode.NAME, END);

        CompiledGraph<ProductResearchState> graph = workflow.compile(CompileConfig.builder().build());
        graph.setMaxIterations(properties.getGraph().getMaxIterations());
        return graph;
    }
}
