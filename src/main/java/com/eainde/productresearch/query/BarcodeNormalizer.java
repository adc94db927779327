package com.eainde.productresearch.query;

import lombok.extern.log4j.Log4j2;

/**
 * Normalizes barcodes to their 12-digit UPC-A form where the digit count allows it.
 *
 * <ul>
 *   <li>12 digits: unchanged</li>
 *   <li>11 digits: left-padded with one {@code 0}</li>
 *   <li>13 digits starting with {@code 0}: leading zero dropped</li>
 *   <li>13 digits otherwise: kept as EAN-13</li>
 *   <li>14 digits: first two digits dropped</li>
 *   <li>anything else: cleaned digits kept</li>
 * </ul>
 * An empty result means the query carries no barcode.
 */
@Log4j2
public final class BarcodeNormalizer {

    private BarcodeNormalizer() {
    }

    public static String normalize(String barcode) {
        if (barcode == null || barcode.isBlank()) {
            return "";
        }
        String digits = barcode.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return "";
        }

        switch (digits.length()) {
            case 12:
                return digits;
            case 11:
                return "0" + digits;
            case 13:
                if (digits.charAt(0) == '0') {
                    return digits.substring(1);
                }
                log.info("Non-standard 13-digit barcode kept as EAN-13: {}", digits);
                return digits;
            case 14:
                return digits.substring(2);
            default:
                log.warn("Barcode length {} out of the expected range, keeping cleaned digits: {}",
                        digits.length(), digits);
                return digits;
        }
    }
}
