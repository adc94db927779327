package com.eainde.productresearch.validation;

import com.eainde.productresearch.model.InvalidUrlRecord;
import com.eainde.productresearch.model.ValidatedPage;

import java.util.List;

/**
 * What one validation pass adds to the run: pages, rejections and the two counters.
 */
public record ValidationDelta(List<ValidatedPage> validatedPages,
                              List<InvalidUrlRecord> invalidUrls,
                              int checked,
                              int images) {

    public ValidationDelta {
        validatedPages = List.copyOf(validatedPages);
        invalidUrls = List.copyOf(invalidUrls);
    }

    public static ValidationDelta empty() {
        return new ValidationDelta(List.of(), List.of(), 0, 0);
    }
}
