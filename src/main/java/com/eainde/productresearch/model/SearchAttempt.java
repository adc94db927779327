package com.eainde.productresearch.model;

import java.util.Arrays;
import java.util.List;

/**
 * Catalog of search attempts, in the order they are tried within each identifier family.
 */
public enum SearchAttempt {

    BARCODE_GOOGLE(SearchProvider.GOOGLE, "search-barcode", "Barcode: {barcode}",
            IdentifierFamily.BARCODE, Variant.FREE_TEXT),
    BARCODE_YAHOO(SearchProvider.YAHOO, "search-barcode", "Barcode: {barcode}",
            IdentifierFamily.BARCODE, Variant.FREE_TEXT),
    BARCODE_WEB(SearchProvider.LLM_WEB_SEARCH, "search-barcode", "Barcode: {barcode}",
            IdentifierFamily.BARCODE, Variant.FREE_TEXT),

    SKU_GOOGLE(SearchProvider.GOOGLE, "search-sku", "SKU: {sku}",
            IdentifierFamily.SKU, Variant.FREE_TEXT),
    SKU_YAHOO(SearchProvider.YAHOO, "search-sku", "SKU: {sku}",
            IdentifierFamily.SKU, Variant.FREE_TEXT),
    SKU_WEB(SearchProvider.LLM_WEB_SEARCH, "search-sku", "SKU: {sku}",
            IdentifierFamily.SKU, Variant.FREE_TEXT),

    TITLE_SKU_GOOGLE(SearchProvider.GOOGLE, "search-title-sku", "Title: {title}, SKU: {sku}",
            IdentifierFamily.TITLE_SKU, Variant.FREE_TEXT),
    ALL_FIELDS_WEB(SearchProvider.LLM_WEB_SEARCH, "search-all-fields",
            "This is the product: Barcode/UPC: {barcode}, Product SKU/part number: {sku}, Title: {title}",
            IdentifierFamily.TITLE_SKU, Variant.STRUCTURED_ALL_FIELDS);

    public enum IdentifierFamily { BARCODE, SKU, TITLE_SKU }

    public enum Variant { FREE_TEXT, STRUCTURED_ALL_FIELDS }

    private final SearchProvider provider;
    private final String promptKey;
    private final String inputTemplate;
    private final IdentifierFamily family;
    private final Variant variant;

    SearchAttempt(SearchProvider provider, String promptKey, String inputTemplate,
                  IdentifierFamily family, Variant variant) {
        this.provider = provider;
        this.promptKey = promptKey;
        this.inputTemplate = inputTemplate;
        this.family = family;
        this.variant = variant;
    }

    public SearchProvider provider() { return provider; }
    public String promptKey() { return promptKey; }
    public String inputTemplate() { return inputTemplate; }
    public IdentifierFamily family() { return family; }
    public Variant variant() { return variant; }

    /** Fills the input template with the query's identifiers. */
    public String formatInput(ProductQuery query) {
        return inputTemplate
                .replace("{barcode}", query.barcode())
                .replace("{sku}", query.sku())
                .replace("{title}", query.title());
    }

    /** Bare search terms for backends that take a plain query string. */
    public String searchTerms(ProductQuery query) {
        return switch (family) {
            case BARCODE -> query.barcode();
            case SKU -> query.sku();
            case TITLE_SKU -> (query.title() + " " + query.sku()).trim();
        };
    }

    public static List<SearchAttempt> forFamily(IdentifierFamily family) {
        return Arrays.stream(values()).filter(a -> a.family == family).toList();
    }
}
