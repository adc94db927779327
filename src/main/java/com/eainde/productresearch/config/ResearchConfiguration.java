package com.eainde.productresearch.config;

import com.eainde.productresearch.batch.BatchCoordinator;
import com.eainde.productresearch.batch.BatchResultCsvWriter;
import com.eainde.productresearch.image.ImageAuthenticityChecker;
import com.eainde.productresearch.model.SearchProvider;
import com.eainde.productresearch.parsing.JsonResponseParser;
import com.eainde.productresearch.prompt.PromptService;
import com.eainde.productresearch.query.SearchPlanBuilder;
import com.eainde.productresearch.search.AllFieldsSearchExecutor;
import com.eainde.productresearch.search.SearchExecutor;
import com.eainde.productresearch.thread.MdcAwareExecutor;
import com.eainde.productresearch.tools.DefaultToolSession;
import com.eainde.productresearch.tools.LanguageModelClient;
import com.eainde.productresearch.tools.PageScrapeTool;
import com.eainde.productresearch.tools.ScrapeVariant;
import com.eainde.productresearch.tools.SearchTool;
import com.eainde.productresearch.tools.ToolSessionFactory;
import com.eainde.productresearch.tools.ToolSessionPool;
import com.eainde.productresearch.tools.model.ChatModelLanguageModelClient;
import com.eainde.productresearch.tools.model.ModelPageScrapeTool;
import com.eainde.productresearch.tools.model.ModelWebSearchTool;
import com.eainde.productresearch.tools.serp.SerpApiSearchTool;
import com.eainde.productresearch.validation.PageValidationService;
import com.eainde.productresearch.workflow.ProductResearchService;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.log4j.Log4j2;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Wires the research stages, their executors and the default tool adapters.
 */
@Log4j2
@Configuration
@EnableConfigurationProperties(ResearchProperties.class)
public class ResearchConfiguration {

    // =========================================================================
    //  Shared infrastructure
    // =========================================================================

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public JsonResponseParser jsonResponseParser(ObjectMapper objectMapper) {
        return new JsonResponseParser(objectMapper);
    }

    @Bean
    public OkHttpClient okHttpClient(ResearchProperties properties) {
        return new OkHttpClient.Builder()
                .callTimeout(properties.getScrape().getTimeout())
                .readTimeout(properties.getScrape().getTimeout())
                .followRedirects(true)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor toolCallExecutor() {
        return MdcAwareExecutor.cached("tool-call");
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor imageCheckExecutor() {
        return MdcAwareExecutor.cached("image-check");
    }

    // =========================================================================
    //  Models
    // =========================================================================

    @Bean
    public ChatModel chatModel(ResearchProperties properties) {
        ResearchProperties.Model model = properties.getModel();
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(model.getApiKey())
                .modelName(model.getModelName())
                .temperature(model.getTemperature())
                .timeout(model.getTimeout())
                .logRequests(model.isLogRequests())
                .logResponses(model.isLogRequests());
        if (StringUtils.hasText(model.getBaseUrl())) {
            builder.baseUrl(model.getBaseUrl());
        }
        return builder.build();
    }

    @Bean
    public ChatModel webSearchChatModel(ResearchProperties properties) {
        ResearchProperties.Model model = properties.getModel();
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(model.getApiKey())
                .modelName(model.getWebSearchModelName())
                .timeout(model.getTimeout())
                .logRequests(model.isLogRequests())
                .logResponses(model.isLogRequests());
        if (StringUtils.hasText(model.getBaseUrl())) {
            builder.baseUrl(model.getBaseUrl());
        }
        return builder.build();
    }

    @Bean
    @Primary
    public LanguageModelClient languageModelClient(@Qualifier("chatModel") ChatModel chatModel,
                                                   JsonResponseParser parser) {
        return new ChatModelLanguageModelClient(chatModel, parser);
    }

    @Bean
    public LanguageModelClient webSearchModelClient(@Qualifier("webSearchChatModel") ChatModel webSearchChatModel,
                                                    JsonResponseParser parser) {
        return new ChatModelLanguageModelClient(webSearchChatModel, parser);
    }

    // =========================================================================
    //  Tools
    // =========================================================================

    @Bean
    public ToolSessionFactory toolSessionFactory(ResearchProperties properties, OkHttpClient okHttpClient,
                                                 ObjectMapper objectMapper, LanguageModelClient languageModelClient,
                                                 @Qualifier("webSearchModelClient") LanguageModelClient webSearchModelClient) {
        ResearchProperties.Serp serp = properties.getSerp();
        int maxPageChars = properties.getScrape().getMaxPageChars();
        int maxPageBytes = properties.getScrape().getMaxPageBytes();
        return () -> {
            Map<SearchProvider, SearchTool> search = new EnumMap<>(SearchProvider.class);
            if (StringUtils.hasText(serp.getApiKey())) {
                OkHttpClient serpClient = okHttpClient.newBuilder().callTimeout(serp.getTimeout()).build();
                search.put(SearchProvider.GOOGLE, new SerpApiSearchTool(serpClient, objectMapper,
                        serp.getBaseUrl(), serp.getApiKey(), serp.getNumResults(), SearchProvider.GOOGLE));
                search.put(SearchProvider.YAHOO, new SerpApiSearchTool(serpClient, objectMapper,
                        serp.getBaseUrl(), serp.getApiKey(), serp.getNumResults(), SearchProvider.YAHOO));
            } else {
                log.warn("No SerpAPI key configured, Google and Yahoo attempts will be exhausted");
            }
            search.put(SearchProvider.LLM_WEB_SEARCH, new ModelWebSearchTool(webSearchModelClient));

            Map<ScrapeVariant, PageScrapeTool> scrape = new EnumMap<>(ScrapeVariant.class);
            for (ScrapeVariant variant : ScrapeVariant.values()) {
                scrape.put(variant, new ModelPageScrapeTool(okHttpClient, languageModelClient, variant,
                        maxPageChars, maxPageBytes));
            }
            return new DefaultToolSession(search, scrape);
        };
    }

    @Bean
    public ToolSessionPool toolSessionPool(ToolSessionFactory toolSessionFactory) {
        return new ToolSessionPool(toolSessionFactory);
    }

    // =========================================================================
    //  Stages
    // =========================================================================

    @Bean
    public SearchPlanBuilder searchPlanBuilder(ResearchProperties properties) {
        return new SearchPlanBuilder(properties.getSearch().getMinSkuLength());
    }

    @Bean
    public SearchExecutor searchExecutor(ToolSessionPool pool, JsonResponseParser parser, PromptService promptService,
                                         @Qualifier("toolCallExecutor") MdcAwareExecutor toolCallExecutor,
                                         ResearchProperties properties) {
        ResearchProperties.Search search = properties.getSearch();
        return new SearchExecutor(pool, parser, promptService, toolCallExecutor,
                search.getMaxRetries(), search.getTimeout());
    }

    @Bean
    public AllFieldsSearchExecutor allFieldsSearchExecutor(
            @Qualifier("webSearchModelClient") LanguageModelClient webSearchModelClient,
            PromptService promptService,
            @Qualifier("toolCallExecutor") MdcAwareExecutor toolCallExecutor,
            ResearchProperties properties) {
        return new AllFieldsSearchExecutor(webSearchModelClient, promptService, toolCallExecutor,
                properties.getSearch().getTimeout());
    }

    @Bean
    public PageValidationService pageValidationService(ToolSessionPool pool, LanguageModelClient languageModelClient,
                                                       JsonResponseParser parser, PromptService promptService,
                                                       ObjectMapper objectMapper,
                                                       @Qualifier("toolCallExecutor") MdcAwareExecutor toolCallExecutor,
                                                       ResearchProperties properties) {
        ResearchProperties.Validation validation = properties.getValidation();
        return new PageValidationService(pool, languageModelClient, parser, promptService, objectMapper,
                toolCallExecutor, new PageValidationService.Settings(
                        validation.getBatchSize(),
                        validation.getBaseTimeout(),
                        validation.getPerUrlTimeout(),
                        validation.isEarlyExit(),
                        validation.getConnectionRetries()));
    }

    @Bean
    public ImageAuthenticityChecker imageAuthenticityChecker(OkHttpClient okHttpClient,
                                                             @Qualifier("imageCheckExecutor") MdcAwareExecutor imageCheckExecutor,
                                                             ResearchProperties properties) {
        ResearchProperties.ImageCheck imageCheck = properties.getImageCheck();
        return new ImageAuthenticityChecker(okHttpClient, imageCheckExecutor, imageCheck.getConcurrency(),
                imageCheck.getTimeout(), imageCheck.getSniffBytes(), imageCheck.getUserAgent());
    }

    @Bean
    public BatchResultCsvWriter batchResultCsvWriter() {
        return new BatchResultCsvWriter();
    }

    @Bean
    public BatchCoordinator batchCoordinator(ProductResearchService researchService, ObjectMapper objectMapper,
                                             BatchResultCsvWriter csvWriter,
                                             ResearchProperties properties, Clock clock) {
        ResearchProperties.Batch batch = properties.getBatch();
        return new BatchCoordinator(researchService, objectMapper, csvWriter,
                batch.getMaxRetries(), batch.getRetryDelay(), Path.of(batch.getOutputDirectory()), clock);
    }
}
