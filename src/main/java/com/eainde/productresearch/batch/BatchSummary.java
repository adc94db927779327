package com.eainde.productresearch.batch;

import com.eainde.productresearch.model.BatchResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Success and failure counts of a batch. A row failed when its result JSON carries an {@code error} field.
 */
public record BatchSummary(int total, int successful, int failed) {

    public static BatchSummary of(List<BatchResult> results, ObjectMapper objectMapper) {
        int failed = 0;
        for (BatchResult result : results) {
            if (isFailed(result.result(), objectMapper)) {
                failed++;
            }
        }
        return new BatchSummary(results.size(), results.size() - failed, failed);
    }

    static boolean isFailed(String resultJson, ObjectMapper objectMapper) {
        if (resultJson == null || resultJson.isBlank()) {
            return true;
        }
        try {
            JsonNode node = objectMapper.readTree(resultJson);
            return node == null || !node.isObject() || node.has("error");
        } catch (Exception e) {
            return resultJson.contains("\"error\"");
        }
    }
}
