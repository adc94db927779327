package com.eainde.productresearch.prompt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptServiceTest {

    private final PromptService promptService = new PromptService();

    @Test
    @DisplayName("fills placeholders and leaves the rest of the template alone")
    void render() {
        Map<String, String> variables = new HashMap<>();
        variables.put("barcode", "012345678905");
        variables.put("sku", null);
        variables.put("title", "Blue Kettle");
        variables.put("search_results", "{\"results\": []}");

        String prompt = promptService.render(PromptService.FILTER, variables);

        assertThat(prompt).contains("012345678905", "Blue Kettle", "{\"results\": []}")
                .doesNotContain("{barcode}", "{sku}", "{title}", "{search_results}");
    }

    @Test
    @DisplayName("placeholder text inside a value is not substituted again")
    void valuesAreNotExpanded() {
        Map<String, String> variables = new HashMap<>();
        variables.put("barcode", "012345678905");
        variables.put("sku", "AB-{barcode}");
        variables.put("title", "Kettle {search_results} edition");
        variables.put("search_results", "{\"results\": [{\"title\": \"{sku} refill\"}]}");

        String prompt = promptService.render(PromptService.FILTER, variables);

        assertThat(prompt).contains("AB-{barcode}", "Kettle {search_results} edition", "\"{sku} refill\"");
    }

    @Test
    @DisplayName("an unknown template fails loudly")
    void unknownTemplate() {
        assertThatThrownBy(() -> promptService.render("does-not-exist", Map.of()))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("does-not-exist");
    }
}
