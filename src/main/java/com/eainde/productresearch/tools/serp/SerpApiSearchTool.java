package com.eainde.productresearch.tools.serp;

import com.eainde.productresearch.model.SearchProvider;
import com.eainde.productresearch.tools.ConnectionDroppedException;
import com.eainde.productresearch.tools.SearchRequest;
import com.eainde.productresearch.tools.SearchTool;
import com.eainde.productresearch.tools.ToolErrors;
import com.eainde.productresearch.tools.ToolException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

/**
 * Google and Yahoo search through a SerpAPI-compatible JSON endpoint.
 *
 * <p>Organic results are reshaped into {@code {"results": [{"title", "url", "snippet"}]}}.
 * A page without organic results is returned verbatim so its zero-result markers
 * ({@code "organic_results_state": "Fully empty"}, {@code "total_results": 0}) stay visible.
 * An API-level {@code error} is raised as a {@link ToolException} carrying the provider message.</p>
 */
@Log4j2
public class SerpApiSearchTool implements SearchTool {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl endpoint;
    private final String apiKey;
    private final int numResults;
    private final SearchProvider provider;

    public SerpApiSearchTool(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                             String apiKey, int numResults, SearchProvider provider) {
        if (provider == SearchProvider.LLM_WEB_SEARCH) {
            throw new IllegalArgumentException("SerpAPI does not serve " + provider);
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.endpoint = HttpUrl.get(baseUrl);
        this.apiKey = apiKey;
        this.numResults = numResults;
        this.provider = provider;
    }

    @Override
    public String search(SearchRequest request) {
        String terms = request.terms() == null || request.terms().isBlank() ? request.input() : request.terms();
        HttpUrl.Builder url = endpoint.newBuilder()
                .addQueryParameter("api_key", apiKey)
                .addQueryParameter("output", "json");
        if (provider == SearchProvider.GOOGLE) {
            url.addQueryParameter("engine", "google")
                    .addQueryParameter("q", terms)
                    .addQueryParameter("num", String.valueOf(numResults));
        } else {
            url.addQueryParameter("engine", "yahoo")
                    .addQueryParameter("p", terms);
        }

        Request httpRequest = new Request.Builder().url(url.build()).get().build();
        log.debug("SerpAPI {} search for '{}'", provider, terms);

        try (Response response = httpClient.newCall(httpRequest).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new ToolException("SerpAPI call failed: " + response.code() + " - " + errorMessage(text));
            }
            return reshape(text);
        } catch (IOException e) {
            if (ToolErrors.isConnectionDropped(e)) {
                throw new ConnectionDroppedException("SerpAPI connection dropped", e);
            }
            throw new ToolException("SerpAPI call failed: " + e.getMessage(), e);
        }
    }

    String reshape(String body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        if (root == null || !root.isObject()) {
            throw new ToolException("SerpAPI returned a non-object body");
        }
        if (root.hasNonNull("error")) {
            throw new ToolException(root.get("error").asText());
        }

        JsonNode organic = root.get("organic_results");
        if (organic == null || !organic.isArray() || organic.isEmpty()) {
            return body;
        }

        ObjectNode reshaped = objectMapper.createObjectNode();
        ArrayNode results = reshaped.putArray("results");
        for (JsonNode hit : organic) {
            String link = hit.path("link").asText("");
            if (link.isEmpty()) continue;
            ObjectNode item = results.addObject();
            item.put("title", hit.path("title").asText(""));
            item.put("url", link);
            item.put("snippet", hit.path("snippet").asText(""));
        }
        return objectMapper.writeValueAsString(reshaped);
    }

    private String errorMessage(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root != null && root.hasNonNull("error")) {
                return root.get("error").asText();
            }
        } catch (IOException e) {
            log.trace("Error body is not JSON", e);
        }
        return body.length() > 500 ? body.substring(0, 500) : body;
    }
}
