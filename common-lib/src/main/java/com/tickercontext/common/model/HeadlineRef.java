package com.tickercontext.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A de-duplicated news citation used as top headline and as a numbered one-liner source.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HeadlineRef(
    @JsonProperty("title") String title,
    @JsonProperty("publisher") String publisher,
    @JsonProperty("url") String url
) {
    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }
}
