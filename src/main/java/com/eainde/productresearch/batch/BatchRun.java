package com.eainde.productresearch.batch;

import com.eainde.productresearch.model.BatchResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Results of a batch in input order, and the absolute path of the CSV they were written to.
 */
public record BatchRun(List<BatchResult> results, Path outputFile) {

    public BatchRun {
        results = List.copyOf(results);
    }
}
