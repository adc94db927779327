package com.eainde.productresearch.state;

import com.eainde.productresearch.model.FinalResult;
import com.eainde.productresearch.model.InvalidUrlRecord;
import com.eainde.productresearch.model.ProductQuery;
import com.eainde.productresearch.model.SearchAttempt;
import com.eainde.productresearch.model.SearchOutcome;
import com.eainde.productresearch.model.ValidatedPage;
import com.eainde.productresearch.query.SearchPlan;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run accumulator of the research graph.
 *
 * <h3>Merge rules</h3>
 * <ul>
 *   <li>{@link #SEARCH_INDEX}: max, so the index never moves back</li>
 *   <li>{@link #VALIDATED_PAGES}: append</li>
 *   <li>{@link #INVALID_URLS}: union by url, first record wins</li>
 *   <li>{@link #TOTAL_VALIDATED_IMAGES}, {@link #TOTAL_CHECKED}: nodes write deltas that are added</li>
 *   <li>everything else: replaced</li>
 * </ul>
 */
public class ProductResearchState extends AgentState {

    // Inputs
    public static final String BARCODE = "barcode";
    public static final String SKU = "sku";
    public static final String TITLE = "title";

    // Written once by initialize
    public static final String PLAN = "plan";
    public static final String SEARCH_TYPE_LABEL = "searchTypeLabel";

    // Search progress
    public static final String SEARCH_INDEX = "searchIndex";
    public static final String CURRENT_SEARCH_RESULTS = "currentSearchResults";
    public static final String SEARCH_SUCCESSFUL = "searchSuccessful";
    public static final String SEARCH_OUTCOME = "searchOutcome";
    public static final String RETRY_COUNT = "retryCount";

    // Filter
    public static final String FILTERED_URLS = "filteredUrls";
    public static final String TOTAL_FILTERED_URLS = "totalFilteredUrls";

    // Accumulated validation
    public static final String VALIDATED_PAGES = "validatedPages";
    public static final String INVALID_URLS = "invalidUrls";
    public static final String TOTAL_VALIDATED_IMAGES = "totalValidatedImages";
    public static final String TOTAL_CHECKED = "totalChecked";

    // Image cleanup
    public static final String CLEANED_VALIDATED_PAGES = "cleanedValidatedPages";
    public static final String CLEANED_TOTAL_VALIDATED_IMAGES = "cleanedTotalValidatedImages";

    public static final String FINAL_RESULT = "finalResult";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
            Map.entry(SEARCH_INDEX, Channels.<Integer>base(StateReducers::max, () -> 0)),
            Map.entry(CURRENT_SEARCH_RESULTS, Channels.<String>base(StateReducers::replace, () -> "")),
            Map.entry(SEARCH_SUCCESSFUL, Channels.<Boolean>base(StateReducers::replace, () -> Boolean.FALSE)),
            Map.entry(SEARCH_OUTCOME, Channels.<SearchOutcome>base(StateReducers::replace, () -> SearchOutcome.NOT_RUN)),
            Map.entry(RETRY_COUNT, Channels.<Integer>base(StateReducers::replace, () -> 0)),
            Map.entry(FILTERED_URLS, Channels.<List<String>>base(StateReducers::replace, ArrayList::new)),
            Map.entry(TOTAL_FILTERED_URLS, Channels.<Integer>base(StateReducers::replace, () -> 0)),
            Map.entry(VALIDATED_PAGES, Channels.<List<ValidatedPage>>base(StateReducers::append, ArrayList::new)),
            Map.entry(INVALID_URLS, Channels.<List<?>>base(StateReducers::mergeInvalidUrls, ArrayList::new)),
            Map.entry(TOTAL_VALIDATED_IMAGES, Channels.<Integer>base(StateReducers::add, () -> 0)),
            Map.entry(TOTAL_CHECKED, Channels.<Integer>base(StateReducers::add, () -> 0))
    );

    public ProductResearchState(Map<String, Object> initData) {
        super(initData);
    }

    /** The query as supplied by the caller, before normalization. */
    public ProductQuery rawQuery() {
        return ProductQuery.ofRawBarcode(
                value(BARCODE).orElse(null),
                this.<Object>value(SKU).map(Object::toString).orElse(""),
                this.<Object>value(TITLE).map(Object::toString).orElse(""));
    }

    public Optional<SearchPlan> plan() {
        return value(PLAN);
    }

    /** Normalized query from the plan, falling back to the raw inputs before initialize ran. */
    public ProductQuery query() {
        return plan().map(SearchPlan::query).orElseGet(this::rawQuery);
    }

    public String searchTypeLabel() {
        return this.<String>value(SEARCH_TYPE_LABEL).orElse(SearchPlan.LABEL_SKU);
    }

    public int searchIndex() {
        return this.<Integer>value(SEARCH_INDEX).orElse(0);
    }

    /** The attempt the index points at, empty once the plan is exhausted. */
    public Optional<SearchAttempt> currentAttempt() {
        int index = searchIndex();
        return plan().filter(p -> index < p.size()).map(p -> p.attempts().get(index));
    }

    public boolean planExhausted() {
        return plan().map(p -> searchIndex() >= p.size()).orElse(true);
    }

    public String currentSearchResults() {
        return this.<String>value(CURRENT_SEARCH_RESULTS).orElse("");
    }

    public boolean searchSuccessful() {
        return this.<Boolean>value(SEARCH_SUCCESSFUL).orElse(false);
    }

    public SearchOutcome searchOutcome() {
        return this.<SearchOutcome>value(SEARCH_OUTCOME).orElse(SearchOutcome.NOT_RUN);
    }

    public int retryCount() {
        return this.<Integer>value(RETRY_COUNT).orElse(0);
    }

    public List<String> filteredUrls() {
        return this.<List<String>>value(FILTERED_URLS).orElse(List.of());
    }

    public List<ValidatedPage> validatedPages() {
        return this.<List<ValidatedPage>>value(VALIDATED_PAGES).orElse(List.of());
    }

    /** Raw invalid entries; may contain legacy plain-string urls. */
    public List<?> invalidUrlEntries() {
        return this.<List<?>>value(INVALID_URLS).orElse(List.of());
    }

    public List<InvalidUrlRecord> invalidUrls() {
        return StateReducers.mergeInvalidUrls(invalidUrlEntries(), List.of());
    }

    public int totalValidatedImages() {
        return this.<Integer>value(TOTAL_VALIDATED_IMAGES).orElse(0);
    }

    public int totalChecked() {
        return this.<Integer>value(TOTAL_CHECKED).orElse(0);
    }

    public Optional<List<ValidatedPage>> cleanedValidatedPages() {
        return value(CLEANED_VALIDATED_PAGES);
    }

    public Optional<Integer> cleanedTotalValidatedImages() {
        return value(CLEANED_TOTAL_VALIDATED_IMAGES);
    }

    public Optional<FinalResult> finalResult() {
        return value(FINAL_RESULT);
    }
}
