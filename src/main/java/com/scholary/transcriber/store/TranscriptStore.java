package com.scholary.transcriber.store;

import java.util.List;
import java.util.Optional;

/**
 * Storage collaborator of the pipeline.
 *
 * <p>Only this contract is required by the job runner; the in-memory implementation is the default
 * and a relational store can be plugged in behind the same interface.
 */
public interface TranscriptStore {

  /** Store a file and return its id. */
  String addFile(FileRecord file);

  Optional<FileRecord> getFile(String fileId);

  void updateFileDuration(String fileId, double durationSeconds);

  /** Remove a file with its storage chunks, transcripts and segments. */
  boolean deleteFile(String fileId);

  /** Store a transcript and return its id. */
  String addTranscript(TranscriptRecord transcript);

  Optional<TranscriptRecord> getTranscript(String transcriptId);

  void updateTranscriptStatus(String transcriptId, TranscriptStatus status);

  /** Transcripts of a file, newest first. */
  List<TranscriptRecord> getTranscriptsByFile(String fileId);

  /** Store segments and return their ids, in input order. */
  List<Long> addSegments(String transcriptId, List<StoredSegment> segments);

  /** Segments of a transcript ordered by start time. */
  List<StoredSegment> getSegmentsByTranscript(String transcriptId);

  /** Store one storage chunk of a large file. */
  void putChunk(String fileId, int index, byte[] data);

  /** Storage chunks of a file in index order. */
  List<byte[]> getChunks(String fileId);
}
