package com.scholary.transcriber.transcription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcriber.audio.AudioSegmenter;
import com.scholary.transcriber.audio.TestAudio;
import com.scholary.transcriber.config.TestProperties;
import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;
import com.scholary.transcriber.provider.ProviderException;
import com.scholary.transcriber.provider.ProviderProperties;
import com.scholary.transcriber.provider.ProviderRequest;
import com.scholary.transcriber.provider.ProviderResponse;
import com.scholary.transcriber.provider.ProviderWord;
import com.scholary.transcriber.provider.TranscriptionProvider;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptionClientTest {

  private static final ProviderResponse RESPONSE =
      new ProviderResponse(
          "hello world",
          "en",
          1.0,
          null,
          List.of(new ProviderWord("hello", 0.0, 0.4), new ProviderWord("world", 0.5, 0.9)));

  @Mock private TranscriptionProvider provider;

  private TranscriptionCache cache;
  private TranscriptionClient client;

  @BeforeEach
  void setUp() {
    cache = new TranscriptionCache(10, Duration.ofMinutes(5), new ObjectMapper());
    client = newClient(TestProperties.transcription());
  }

  @Test
  void transcribe_shouldServeRepeatedRequestsFromCache() {
    when(provider.transcribe(any())).thenReturn(RESPONSE);
    AudioSource source = new AudioSource("a.wav", "audio/wav", TestAudio.tone(1), 1000L);

    TranscriptionResult first = client.transcribe(source, TranscriptionOptions.defaults());
    TranscriptionResult second = client.transcribe(source, TranscriptionOptions.defaults());

    verify(provider, times(1)).transcribe(any());
    assertThat(second).isEqualTo(first);
    assertThat(first.text()).isEqualTo("hello world");
    assertThat(first.segments()).hasSize(1);
    assertThat(client.getUsageStats().cacheHits()).isEqualTo(1);
    assertThat(client.getUsageStats().requestCount()).isEqualTo(2);
  }

  @Test
  void transcribe_shouldMissCacheWhenOptionsChange() {
    when(provider.transcribe(any())).thenReturn(RESPONSE);
    AudioSource source = new AudioSource("a.wav", "audio/wav", TestAudio.tone(1), 1000L);

    client.transcribe(source, TranscriptionOptions.defaults());
    client.transcribe(source, new TranscriptionOptions("de", null, 0.0, null, null));

    verify(provider, times(2)).transcribe(any());
  }

  @Test
  void transcribe_shouldReportProgressStages() {
    when(provider.transcribe(any())).thenReturn(RESPONSE);
    List<Integer> percents = new ArrayList<>();
    TranscriptionOptions options =
        TranscriptionOptions.defaults().withListener((percent, stage) -> percents.add(percent));

    client.transcribe(new AudioSource("a.wav", "audio/wav", TestAudio.tone(1), 1L), options);

    assertThat(percents).containsExactly(10, 30, 90, 100);
  }

  @Test
  void transcribe_shouldRejectUploadsOverProviderLimit() {
    TranscriptionProperties tiny = TestProperties.transcription(60, 10L * 1024 * 1024, 100);
    TranscriptionClient limited = newClient(tiny);

    assertThatThrownBy(
            () ->
                limited.transcribe(
                    new AudioSource("a.wav", "audio/wav", TestAudio.tone(1), 1L),
                    TranscriptionOptions.defaults()))
        .isInstanceOf(TranscriberException.class)
        .satisfies(
            e -> assertThat(((TranscriberException) e).getKind()).isEqualTo(ErrorKind.FILE_TOO_LARGE));
    verify(provider, never()).transcribe(any());
    assertThat(limited.getUsageStats().errorCount()).isEqualTo(1);
  }

  @Test
  void transcribe_shouldConvertUnpreferredFormatsToWav() {
    when(provider.transcribe(any())).thenReturn(RESPONSE);
    byte[] audio = TestAudio.tone(1);

    client.transcribe(new AudioSource("a.aiff", "audio/aiff", audio, 1L), TranscriptionOptions.defaults());

    ArgumentCaptor<ProviderRequest> sent = ArgumentCaptor.forClass(ProviderRequest.class);
    verify(provider).transcribe(sent.capture());
    assertThat(sent.getValue().filename()).isEqualTo("a.wav");
    assertThat(sent.getValue().contentType()).isEqualTo("audio/wav");
    assertThat(sent.getValue().model()).isEqualTo("default-model");
  }

  @Test
  void transcribe_shouldSendUndecodableAudioUnchanged() {
    when(provider.transcribe(any())).thenReturn(RESPONSE);
    byte[] opaque = {1, 2, 3, 4, 5};

    client.transcribe(new AudioSource("a.m4a", "audio/mp4", opaque, 1L), TranscriptionOptions.defaults());

    ArgumentCaptor<ProviderRequest> sent = ArgumentCaptor.forClass(ProviderRequest.class);
    verify(provider).transcribe(sent.capture());
    assertThat(sent.getValue().audio()).isEqualTo(opaque);
    assertThat(sent.getValue().filename()).isEqualTo("a.m4a");
  }

  @Test
  void transcribe_shouldClassifyProviderFailures() {
    when(provider.transcribe(any())).thenThrow(new IllegalStateException("429 Too Many Requests"));

    assertThatThrownBy(
            () ->
                client.transcribe(
                    new AudioSource("a.wav", "audio/wav", TestAudio.tone(1), 1L),
                    TranscriptionOptions.defaults()))
        .isInstanceOf(TranscriberException.class)
        .satisfies(
            e -> assertThat(((TranscriberException) e).getKind()).isEqualTo(ErrorKind.RATE_LIMIT));
    assertThat(client.getUsageStats().lastError()).contains("429");
  }

  @Test
  void executeWithRetry_shouldRetryRetryableFailures() {
    AtomicInteger calls = new AtomicInteger();
    RetryPolicy policy = new RetryPolicy(3, 1, 2.0, 5);

    String result =
        client.executeWithRetry(
            () -> {
              if (calls.incrementAndGet() < 3) {
                throw new IOException("connection reset");
              }
              return "ok";
            },
            policy);

    assertThat(result).isEqualTo("ok");
    assertThat(calls).hasValue(3);
  }

  @Test
  void executeWithRetry_shouldGiveUpAfterMaxAttempts() {
    AtomicInteger calls = new AtomicInteger();
    RetryPolicy policy = new RetryPolicy(2, 1, 2.0, 5);

    assertThatThrownBy(
            () ->
                client.executeWithRetry(
                    () -> {
                      calls.incrementAndGet();
                      throw new ProviderException(ErrorKind.TIMEOUT, "slow");
                    },
                    policy))
        .isInstanceOf(ProviderException.class);
    assertThat(calls).hasValue(2);
  }

  @Test
  void executeWithRetry_shouldNotRetryNonRetryableFailures() {
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                client.executeWithRetry(
                    () -> {
                      calls.incrementAndGet();
                      throw new ProviderException(ErrorKind.QUOTA_EXCEEDED, "out of credits");
                    },
                    new RetryPolicy(5, 1, 2.0, 5)))
        .isInstanceOf(ProviderException.class);
    assertThat(calls).hasValue(1);
  }

  @Test
  void executeWithRetry_shouldPropagateCancellation() {
    assertThatThrownBy(
            () ->
                client.executeWithRetry(
                    () -> {
                      throw new CancellationException("stop");
                    },
                    new RetryPolicy(5, 1, 2.0, 5)))
        .isInstanceOf(CancellationException.class);
  }

  @Test
  void retryPolicy_shouldCapDelay() {
    RetryPolicy policy = new RetryPolicy(5, 100, 2.0, 300);

    assertThat(policy.delayFor(0)).isEqualTo(100);
    assertThat(policy.delayFor(1)).isEqualTo(200);
    assertThat(policy.delayFor(2)).isEqualTo(300);
  }

  private TranscriptionClient newClient(TranscriptionProperties properties) {
    AudioSegmenter segmenter = new AudioSegmenter();
    return new TranscriptionClient(
        provider,
        new AudioOptimizer(segmenter, properties),
        cache,
        new SegmentReconstructor(),
        new ProviderProperties("http://localhost", "key", "default-model", 1, 1),
        properties);
  }
}
