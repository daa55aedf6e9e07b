package com.scholary.transcriber.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Provider response.
 *
 * <p>Depending on the model and granularity the provider returns segments, words, both, or only
 * text. Missing lists are null, not empty.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderResponse(
    String text,
    String language,
    Double duration,
    List<ProviderSegment> segments,
    List<ProviderWord> words) {}
