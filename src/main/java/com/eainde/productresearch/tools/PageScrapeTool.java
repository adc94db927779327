package com.eainde.productresearch.tools;

import com.eainde.productresearch.model.ValidationReport;

import java.util.List;

/**
 * Opens pages and judges them against the validation instructions.
 */
public interface PageScrapeTool {

    ValidationReport validate(List<String> urls, String instructions);
}
