package com.eainde.productresearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from {@code product-research.*} in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "product-research")
public class ResearchProperties {

    private Search search = new Search();
    private Validation validation = new Validation();
    private ImageCheck imageCheck = new ImageCheck();
    private Batch batch = new Batch();
    private Graph graph = new Graph();
    private Model model = new Model();
    private Serp serp = new Serp();
    private Scrape scrape = new Scrape();

    @Data
    public static class Search {
        private int maxRetries = 3;
        private Duration timeout = Duration.ofSeconds(60);
        private int minSkuLength = 5;
    }

    @Data
    public static class Validation {
        private int batchSize = 3;
        private Duration baseTimeout = Duration.ofSeconds(60);
        private Duration perUrlTimeout = Duration.ofSeconds(45);
        private boolean earlyExit = true;
        /** Extra tries for a batch whose connection dropped. */
        private int connectionRetries = 2;
    }

    @Data
    public static class ImageCheck {
        private int concurrency = 10;
        private Duration timeout = Duration.ofSeconds(10);
        private int sniffBytes = 16;
        private String userAgent = "Mozilla/5.0 (compatible; ProductResearchBot/1.0)";
    }

    @Data
    public static class Batch {
        private int concurrency = 3;
        private int maxRetries = 1;
        private Duration retryDelay = Duration.ofSeconds(1);
        private String outputDirectory = ".";
    }

    @Data
    public static class Graph {
        private int maxIterations = 50;
    }

    @Data
    public static class Model {
        private String apiKey;
        private String baseUrl;
        private String modelName = "gpt-4o-mini";
        /** Model used for provider-less web search and the all-fields attempt. */
        private String webSearchModelName = "gpt-4o-mini-search-preview";
        private double temperature = 0.0;
        private Duration timeout = Duration.ofSeconds(120);
        private boolean logRequests = false;
    }

    @Data
    public static class Serp {
        private String apiKey;
        private String baseUrl = "https://serpapi.com/search.json";
        private int numResults = 10;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Scrape {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxPageChars = 40_000;
        /** Download cap per page; the rest of the body is not read. */
        private int maxPageBytes = 2 * 1024 * 1024;
    }
}
