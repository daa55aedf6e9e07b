package com.scholary.transcriber.provider;

/**
 * Remote speech-to-text service.
 *
 * <p>This is the only network dependency of the transcription client. Implementations make exactly
 * one call per invocation; retries and caching happen above this interface.
 */
public interface TranscriptionProvider {

  /**
   * Transcribe audio.
   *
   * @param request audio and recognition options
   * @return the provider's response
   * @throws ProviderException classified failure of the call
   */
  ProviderResponse transcribe(ProviderRequest request);
}
