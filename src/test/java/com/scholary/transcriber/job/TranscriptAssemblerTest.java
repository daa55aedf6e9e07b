package com.scholary.transcriber.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.scholary.transcriber.transcription.TranscriptionResult;
import com.scholary.transcriber.transcription.TranscriptionSegment;
import com.scholary.transcriber.transcription.WordTimestamp;
import java.util.List;
import org.junit.jupiter.api.Test;

class TranscriptAssemblerTest {

  @Test
  void assemble_shouldShiftSegmentsToAbsoluteTime() {
    ChunkTranscript only = chunk(0, 30, 75, segment(2, 4, "hello"));

    List<TranscriptionSegment> merged = TranscriptAssembler.assemble(List.of(only));

    assertThat(merged).hasSize(1);
    assertThat(merged.get(0).start()).isCloseTo(32, within(1e-9));
    assertThat(merged.get(0).end()).isCloseTo(34, within(1e-9));
    assertThat(merged.get(0).wordTimestamps().get(0).start()).isCloseTo(32, within(1e-9));
  }

  @Test
  void assemble_shouldCutOverlapAtMidpoint() {
    // Chunks [0,45] and [40,85] overlap on [40,45], cut at 42.5
    ChunkTranscript first =
        chunk(0, 0, 45, segment(0, 10, "a"), segment(41, 44, "dup early"));
    ChunkTranscript second =
        chunk(1, 40, 85, segment(1, 4, "dup late"), segment(3, 10, "b"), segment(20, 30, "c"));

    List<TranscriptionSegment> merged = TranscriptAssembler.assemble(List.of(first, second));

    assertThat(merged).extracting(TranscriptionSegment::text).containsExactly("a", "dup early", "b", "c");
    assertThat(merged).extracting(TranscriptionSegment::id).containsExactly(0, 1, 2, 3);
    assertThat(merged.get(2).start()).isCloseTo(43, within(1e-9));
  }

  @Test
  void assemble_shouldOrderChunksByIndex() {
    ChunkTranscript first = chunk(0, 0, 10, segment(1, 2, "first"));
    ChunkTranscript second = chunk(1, 10, 20, segment(1, 2, "second"));

    List<TranscriptionSegment> merged = TranscriptAssembler.assemble(List.of(second, first));

    assertThat(merged).extracting(TranscriptionSegment::text).containsExactly("first", "second");
  }

  @Test
  void assemble_shouldKeepOverlapWhenNeighbourIsMissing() {
    // Chunk 1 failed, so chunk 0 and chunk 2 keep their overlapping speech
    ChunkTranscript first = chunk(0, 0, 45, segment(42, 44, "tail"));
    ChunkTranscript third = chunk(2, 80, 125, segment(0, 2, "head"));

    List<TranscriptionSegment> merged = TranscriptAssembler.assemble(List.of(first, third));

    assertThat(merged).extracting(TranscriptionSegment::text).containsExactly("tail", "head");
  }

  @Test
  void assemble_shouldReturnEmptyForNoChunks() {
    assertThat(TranscriptAssembler.assemble(List.of())).isEmpty();
  }

  private static ChunkTranscript chunk(
      int index, double start, double end, TranscriptionSegment... segments) {
    return new ChunkTranscript(
        index, start, end, new TranscriptionResult("", "en", end - start, List.of(segments)));
  }

  private static TranscriptionSegment segment(double start, double end, String text) {
    return new TranscriptionSegment(
        0, start, end, text, List.of(new WordTimestamp(text, start, end)), 0.9);
  }
}
