package com.scholary.transcriber.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Word-level timestamp as returned by the provider. {@code end} may be missing. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderWord(String word, Double start, Double end) {}
