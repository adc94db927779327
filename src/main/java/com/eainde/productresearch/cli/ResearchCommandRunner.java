package com.eainde.productresearch.cli;

import com.eainde.productresearch.model.FinalResult;
import com.eainde.productresearch.model.ProductQuery;
import com.eainde.productresearch.workflow.ProductResearchService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

/**
 * Researches one product when {@code --barcode}, {@code --sku} or {@code --title} is given
 * and prints the result as JSON on standard output.
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class ResearchCommandRunner implements ApplicationRunner {

    static final String BARCODE = "barcode";
    static final String SKU = "sku";
    static final String TITLE = "title";

    private final ProductResearchService researchService;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) throws JsonProcessingException {
        Optional<ProductQuery> query = toQuery(args);
        if (query.isEmpty()) {
            log.info("No --barcode, --sku or --title given, nothing to research");
            return;
        }
        FinalResult result = researchService.runSingle(query.get());
        print(result, System.out);
    }

    static Optional<ProductQuery> toQuery(ApplicationArguments args) {
        if (!args.containsOption(BARCODE) && !args.containsOption(SKU) && !args.containsOption(TITLE)) {
            return Optional.empty();
        }
        return Optional.of(new ProductQuery(first(args, BARCODE), first(args, SKU), first(args, TITLE)));
    }

    void print(FinalResult result, PrintStream out) throws JsonProcessingException {
        out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
    }

    private static String first(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
