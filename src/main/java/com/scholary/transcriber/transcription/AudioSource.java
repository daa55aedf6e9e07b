package com.scholary.transcriber.transcription;

/**
 * Audio handed to the transcription client, with the identity used for caching.
 *
 * @param filename original file name
 * @param contentType MIME type, may be null when unknown
 * @param data encoded audio
 * @param lastModified modification time of the source file in epoch millis
 */
public record AudioSource(String filename, String contentType, byte[] data, long lastModified) {

  public long size() {
    return data.length;
  }

  AudioSource withData(String newFilename, String newContentType, byte[] newData) {
    return new AudioSource(newFilename, newContentType, newData, lastModified);
  }

  @Override
  public String toString() {
    return String.format(
        "AudioSource[filename=%s, contentType=%s, bytes=%d]", filename, contentType, data.length);
  }
}
