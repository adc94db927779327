package com.eainde.productresearch.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class BarcodeNormalizerTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "012345678905, 012345678905",
            "12345678905, 012345678905",
            "0012345678905, 012345678905",
            "4006381333931, 4006381333931",
            "10012345678905, 012345678905",
            "12345, 12345",
            "'0 12345-67890 5', 012345678905"
    })
    @DisplayName("normalizes by digit count")
    void normalizesByDigitCount(String input, String expected) {
        assertThat(BarcodeNormalizer.normalize(input)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "n/a", "--"})
    @DisplayName("no digits means no barcode")
    void noDigitsMeansNoBarcode(String input) {
        assertThat(BarcodeNormalizer.normalize(input)).isEmpty();
    }

    @Test
    @DisplayName("is idempotent on a normalized UPC-A")
    void idempotent() {
        String once = BarcodeNormalizer.normalize("12345678905");
        assertThat(BarcodeNormalizer.normalize(once)).isEqualTo(once);
    }
}
