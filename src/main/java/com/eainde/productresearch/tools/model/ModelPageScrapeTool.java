package com.eainde.productresearch.tools.model;

import com.eainde.productresearch.model.ValidationReport;
import com.eainde.productresearch.schema.ResearchSchemas;
import com.eainde.productresearch.tools.ConnectionDroppedException;
import com.eainde.productresearch.tools.LanguageModelClient;
import com.eainde.productresearch.tools.PageScrapeTool;
import com.eainde.productresearch.tools.ScrapeVariant;
import com.eainde.productresearch.tools.ToolErrors;
import lombok.extern.log4j.Log4j2;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Downloads each page, reduces it to text plus the image URLs it references, and asks the model
 * for a validation report. Marketplace pages are requested with browser-like headers.
 */
@Log4j2
public class ModelPageScrapeTool implements PageScrapeTool {

    static final int DEFAULT_MAX_PAGE_BYTES = 2 * 1024 * 1024;

    private static final String IMAGE_REFS =
            "img[src], img[data-src], img[data-old-hires], meta[property=og:image]";
    private static final String[] IMAGE_ATTRIBUTES = {"src", "data-src", "data-old-hires", "content"};

    private static final String BROWSER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";
    private static final int MAX_IMAGES_PER_PAGE = 40;

    private final OkHttpClient httpClient;
    private final LanguageModelClient languageModel;
    private final ScrapeVariant variant;
    private final int maxPageChars;
    private final int maxPageBytes;

    public ModelPageScrapeTool(OkHttpClient httpClient, LanguageModelClient languageModel,
                               ScrapeVariant variant, int maxPageChars) {
        this(httpClient, languageModel, variant, maxPageChars, DEFAULT_MAX_PAGE_BYTES);
    }

    public ModelPageScrapeTool(OkHttpClient httpClient, LanguageModelClient languageModel,
                               ScrapeVariant variant, int maxPageChars, int maxPageBytes) {
        this.httpClient = httpClient;
        this.languageModel = languageModel;
        this.variant = variant;
        this.maxPageChars = maxPageChars;
        this.maxPageBytes = Math.max(1, maxPageBytes);
    }

    @Override
    public ValidationReport validate(List<String> urls, String instructions) {
        StringBuilder pages = new StringBuilder();
        for (String url : urls) {
            pages.append("=== PAGE ").append(url).append(" ===\n");
            pages.append(scrape(url)).append("\n\n");
        }
        return languageModel.completeStructured(instructions, pages.toString(),
                ResearchSchemas.VALIDATION_REPORT, ValidationReport.class);
    }

    String scrape(String url) {
        Request.Builder request = new Request.Builder().get();
        try {
            request.url(url);
        } catch (IllegalArgumentException e) {
            return "Page could not be accessed: malformed url";
        }
        if (variant == ScrapeVariant.MARKETPLACE) {
            request.header("User-Agent", BROWSER_AGENT)
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "en-US,en;q=0.9");
        }

        try (Response response = httpClient.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                return "Page could not be accessed: HTTP " + response.code();
            }
            ResponseBody body = response.body();
            if (body == null) {
                return "Page could not be accessed: empty body";
            }
            byte[] head;
            try (InputStream in = body.byteStream()) {
                head = in.readNBytes(maxPageBytes);
            }
            if (head.length == maxPageBytes) {
                log.debug("Page {} truncated to {} bytes", url, maxPageBytes);
            }
            MediaType type = body.contentType();
            Charset charset = type == null ? null : type.charset();
            Document document = Jsoup.parse(new ByteArrayInputStream(head),
                    charset == null ? null : charset.name(), response.request().url().toString());
            return toText(document);
        } catch (IOException e) {
            if (ToolErrors.isConnectionDropped(e)) {
                throw new ConnectionDroppedException("Connection dropped while fetching " + url, e);
            }
            log.debug("Fetching {} failed: {}", url, e.getMessage());
            return "Page could not be accessed: " + ToolErrors.describe(e);
        }
    }

    String toText(String html, String baseUri) {
        return toText(Jsoup.parse(html, baseUri));
    }

    String toText(Document document) {
        Set<String> images = new LinkedHashSet<>();
        for (Element element : document.select(IMAGE_REFS)) {
            for (String attribute : IMAGE_ATTRIBUTES) {
                String image = element.hasAttr(attribute) ? element.absUrl(attribute) : "";
                if (!image.isEmpty() && images.size() < MAX_IMAGES_PER_PAGE) {
                    images.add(image);
                }
            }
        }

        document.select("script, style, noscript").remove();
        String text = document.body() == null ? document.text() : document.body().text();
        if (text.length() > maxPageChars) {
            text = text.substring(0, maxPageChars);
        }

        StringBuilder out = new StringBuilder();
        if (!document.title().isBlank()) {
            out.append("Title: ").append(document.title()).append('\n');
        }
        out.append(text);
        if (!images.isEmpty()) {
            out.append("\nImages referenced on the page:\n");
            images.forEach(image -> out.append("- ").append(image).append('\n'));
        }
        return out.toString();
    }
}
