package com.scholary.transcriber.transcription;

import com.scholary.transcriber.provider.ProviderResponse;
import com.scholary.transcriber.provider.ProviderSegment;
import com.scholary.transcriber.provider.ProviderWord;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns a provider response into time-aligned segments.
 *
 * <p>Providers return different shapes depending on model and granularity. In order of preference:
 *
 * <ol>
 *   <li>native segments, mapped one to one with their word timings;
 *   <li>words only, grouped ten at a time;
 *   <li>text only, split into sentences on Latin and CJK terminators with the duration shared out
 *       by word count.
 * </ol>
 *
 * <p>A word without an end time ends where it starts. A segment without a confidence gets 0.95.
 */
@Component
public class SegmentReconstructor {

  static final int WORDS_PER_SEGMENT = 10;
  static final double DEFAULT_CONFIDENCE = 0.95;
  // Used to estimate duration when the provider does not report one
  static final double CHARS_PER_SECOND = 2.5;

  private static final Pattern SENTENCE_TERMINATORS = Pattern.compile("[。！？.!?]+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public List<TranscriptionSegment> reconstruct(ProviderResponse response) {
    if (response.segments() != null && !response.segments().isEmpty()) {
      return fromSegments(response.segments(), response.words());
    }
    if (response.words() != null && !response.words().isEmpty()) {
      return fromWords(response.words());
    }
    if (response.text() != null && !response.text().isBlank()) {
      return fromText(response.text(), response.duration());
    }
    return List.of();
  }

  private List<TranscriptionSegment> fromSegments(
      List<ProviderSegment> segments, List<ProviderWord> topLevelWords) {
    List<TranscriptionSegment> result = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i++) {
      ProviderSegment segment = segments.get(i);
      List<WordTimestamp> words;
      if (segment.words() != null && !segment.words().isEmpty()) {
        words = toWordTimestamps(segment.words());
      } else {
        words = wordsWithin(topLevelWords, segment.start(), segment.end());
      }
      double confidence =
          segment.avgLogprob() != null
              ? Math.max(0, Math.min(1, Math.exp(segment.avgLogprob())))
              : DEFAULT_CONFIDENCE;
      result.add(
          new TranscriptionSegment(
              i, segment.start(), segment.end(), trim(segment.text()), words, confidence));
    }
    return result;
  }

  private List<TranscriptionSegment> fromWords(List<ProviderWord> providerWords) {
    List<WordTimestamp> words = toWordTimestamps(providerWords);
    List<TranscriptionSegment> result = new ArrayList<>();
    for (int from = 0; from < words.size(); from += WORDS_PER_SEGMENT) {
      List<WordTimestamp> group = words.subList(from, Math.min(from + WORDS_PER_SEGMENT, words.size()));
      String text =
          String.join(" ", group.stream().map(w -> w.word().trim()).toList()).trim();
      result.add(
          new TranscriptionSegment(
              result.size(),
              group.get(0).start(),
              group.get(group.size() - 1).end(),
              text,
              group,
              DEFAULT_CONFIDENCE));
    }
    return result;
  }

  private List<TranscriptionSegment> fromText(String text, Double reportedDuration) {
    List<String> sentences =
        Arrays.stream(SENTENCE_TERMINATORS.split(text))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    if (sentences.isEmpty()) {
      return List.of();
    }

    double totalDuration =
        reportedDuration != null && reportedDuration > 0
            ? reportedDuration
            : text.length() / CHARS_PER_SECOND;

    int totalWords = 0;
    List<String[]> sentenceWords = new ArrayList<>(sentences.size());
    for (String sentence : sentences) {
      String[] words = WHITESPACE.split(sentence);
      sentenceWords.add(words);
      totalWords += words.length;
    }

    List<TranscriptionSegment> result = new ArrayList<>(sentences.size());
    double cursor = 0;
    for (int i = 0; i < sentences.size(); i++) {
      String[] words = sentenceWords.get(i);
      double sentenceDuration = totalDuration * words.length / totalWords;
      double start = cursor;
      double end = i == sentences.size() - 1 ? totalDuration : start + sentenceDuration;

      double perWord = (end - start) / words.length;
      List<WordTimestamp> timestamps = new ArrayList<>(words.length);
      for (int w = 0; w < words.length; w++) {
        timestamps.add(new WordTimestamp(words[w], start + w * perWord, start + (w + 1) * perWord));
      }

      result.add(
          new TranscriptionSegment(i, start, end, sentences.get(i), timestamps, DEFAULT_CONFIDENCE));
      cursor = end;
    }
    return result;
  }

  private static List<WordTimestamp> wordsWithin(List<ProviderWord> words, double start, double end) {
    if (words == null || words.isEmpty()) {
      return List.of();
    }
    List<WordTimestamp> within = new ArrayList<>();
    for (WordTimestamp word : toWordTimestamps(words)) {
      if (word.start() >= start && word.start() < end) {
        within.add(word);
      }
    }
    return within;
  }

  private static List<WordTimestamp> toWordTimestamps(List<ProviderWord> words) {
    List<WordTimestamp> result = new ArrayList<>(words.size());
    for (ProviderWord word : words) {
      double start = word.start() != null ? word.start() : 0;
      double end = word.end() != null ? word.end() : start;
      result.add(new WordTimestamp(word.word() == null ? "" : word.word(), start, end));
    }
    return result;
  }

  private static String trim(String text) {
    return text == null ? "" : text.trim();
  }
}
