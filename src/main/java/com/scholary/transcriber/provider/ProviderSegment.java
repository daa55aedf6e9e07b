package com.scholary.transcriber.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Segment as returned by the provider in verbose JSON mode. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderSegment(
    Integer id,
    double start,
    double end,
    String text,
    @JsonProperty("avg_logprob") Double avgLogprob,
    @JsonProperty("no_speech_prob") Double noSpeechProb,
    List<ProviderWord> words) {}
