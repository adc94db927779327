package com.eainde.productresearch.model;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * Identifiers of the product being researched. Absent values are held as empty strings.
 */
public record ProductQuery(String barcode, String sku, String title) implements Serializable {

    public ProductQuery {
        barcode = barcode == null ? "" : barcode.trim();
        sku = sku == null ? "" : sku.trim();
        title = title == null ? "" : title.trim();
    }

    /**
     * Builds a query whose barcode may arrive as a number from spreadsheet parsing
     * ({@code 12345678901L}, {@code 1.2345678901E10}). Numbers are rendered without
     * a decimal point or exponent.
     */
    public static ProductQuery ofRawBarcode(Object barcode, String sku, String title) {
        return new ProductQuery(renderBarcode(barcode), sku, title);
    }

    static String renderBarcode(Object raw) {
        if (raw == null) return "";
        if (raw instanceof Number number) {
            BigDecimal decimal = new BigDecimal(number.toString());
            return decimal.stripTrailingZeros().toPlainString();
        }
        return raw.toString();
    }

    /** Key used in logs and MDC to identify the run. */
    public String key() {
        if (!barcode.isEmpty()) return barcode;
        if (!sku.isEmpty()) return sku;
        return title.isEmpty() ? "unknown" : title;
    }
}
