package com.scholary.transcriber.provider;

/**
 * One transcription call.
 *
 * @param audio encoded audio bytes
 * @param filename name sent with the upload; the provider uses its extension to pick a decoder
 * @param contentType MIME type of {@code audio}
 * @param language ISO-639-1 hint, or null to let the provider detect it
 * @param model provider model name
 * @param temperature sampling temperature, 0 for deterministic output
 * @param prompt optional context prompt, may be null
 */
public record ProviderRequest(
    byte[] audio,
    String filename,
    String contentType,
    String language,
    String model,
    double temperature,
    String prompt) {

  @Override
  public String toString() {
    return String.format(
        "ProviderRequest[filename=%s, bytes=%d, model=%s, language=%s]",
        filename, audio == null ? 0 : audio.length, model, language);
  }
}
