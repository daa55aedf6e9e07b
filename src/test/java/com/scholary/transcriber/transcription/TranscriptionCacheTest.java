package com.scholary.transcriber.transcription;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class TranscriptionCacheTest {

  private final TranscriptionCache cache =
      new TranscriptionCache(3, Duration.ofMinutes(5), new ObjectMapper());

  @Test
  void keyFor_shouldBeStableForSameIdentity() {
    AudioSource source = new AudioSource("a.wav", "audio/wav", new byte[] {1, 2}, 10L);

    String first = cache.keyFor(source, TranscriptionOptions.defaults(), "m");
    String second =
        cache.keyFor(
            new AudioSource("a.wav", "audio/mpeg", new byte[] {9, 9}, 10L),
            TranscriptionOptions.defaults().withListener((p, s) -> {}),
            "m");

    assertThat(first).hasSize(64).isEqualTo(second);
  }

  @Test
  void keyFor_shouldChangeWithIdentityFields() {
    AudioSource source = new AudioSource("a.wav", "audio/wav", new byte[] {1, 2}, 10L);
    String base = cache.keyFor(source, TranscriptionOptions.defaults(), "m");

    assertThat(cache.keyFor(source, TranscriptionOptions.defaults(), "other")).isNotEqualTo(base);
    assertThat(cache.keyFor(new AudioSource("a.wav", "audio/wav", new byte[] {1, 2}, 11L), TranscriptionOptions.defaults(), "m"))
        .isNotEqualTo(base);
    assertThat(cache.keyFor(new AudioSource("b.wav", "audio/wav", new byte[] {1, 2}, 10L), TranscriptionOptions.defaults(), "m"))
        .isNotEqualTo(base);
    assertThat(cache.keyFor(source, new TranscriptionOptions("en", null, 0.0, null, null), "m"))
        .isNotEqualTo(base);
    assertThat(cache.keyFor(source, new TranscriptionOptions(null, null, 0.5, null, null), "m"))
        .isNotEqualTo(base);
  }

  @Test
  void get_shouldReturnStoredResult() {
    TranscriptionResult result = new TranscriptionResult("hi", "en", 1.0, List.of());
    cache.put("k", result);

    assertThat(cache.get("k")).contains(result);
    assertThat(cache.get("missing")).isEmpty();
    assertThat(cache.getStats()).contains("size=1");
  }

  @Test
  void put_shouldBoundSize() {
    for (int i = 0; i < 10; i++) {
      cache.put("k" + i, new TranscriptionResult("t" + i, "en", 1.0, List.of()));
    }
    cache.cleanUp();

    assertThat(cache.size()).isLessThanOrEqualTo(3);
  }
}
