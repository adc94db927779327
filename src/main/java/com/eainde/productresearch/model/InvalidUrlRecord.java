package com.eainde.productresearch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InvalidUrlRecord(
        @JsonProperty("url") String url,
        @JsonProperty("reasoning") String reasoning
) implements Serializable {

    public InvalidUrlRecord {
        url = url == null ? "" : url;
        reasoning = reasoning == null ? "" : reasoning;
    }
}
