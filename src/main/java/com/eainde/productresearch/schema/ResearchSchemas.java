package com.eainde.productresearch.schema;

import dev.langchain4j.model.chat.request.json.JsonSchema;

/**
 * Response schemas sent with structured model calls.
 */
public final class ResearchSchemas {

    public static final JsonSchema VALIDATION_REPORT =
            JsonSchemaConverter.fromResource("validation_report", "schemas/validation-report.json");

    public static final JsonSchema ALL_FIELDS_SEARCH =
            JsonSchemaConverter.fromResource("all_fields_search", "schemas/all-fields-search.json");

    private ResearchSchemas() {
    }
}
