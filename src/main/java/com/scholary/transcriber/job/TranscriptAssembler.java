package com.scholary.transcriber.job;

import com.scholary.transcriber.transcription.TranscriptionSegment;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins chunk transcripts into one time line.
 *
 * <p>Chunks are put back in index order and their segments moved by the chunk's start time.
 * Neighbouring chunks overlap, so speech in the overlap is transcribed twice. The overlap is cut at
 * its midpoint: the earlier chunk keeps segments starting before it, the later chunk keeps segments
 * starting at or after it. A chunk whose neighbour failed keeps everything on that side.
 */
final class TranscriptAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptAssembler.class);

  private TranscriptAssembler() {}

  static List<TranscriptionSegment> assemble(List<ChunkTranscript> chunks) {
    List<ChunkTranscript> ordered = new ArrayList<>(chunks);
    ordered.sort(Comparator.comparingInt(ChunkTranscript::chunkIndex));

    List<TranscriptionSegment> merged = new ArrayList<>();
    int dropped = 0;
    for (int i = 0; i < ordered.size(); i++) {
      ChunkTranscript chunk = ordered.get(i);
      double lower = Double.NEGATIVE_INFINITY;
      double upper = Double.POSITIVE_INFINITY;
      if (i > 0 && overlaps(ordered.get(i - 1), chunk)) {
        lower = (chunk.startTime() + ordered.get(i - 1).endTime()) / 2;
      }
      if (i + 1 < ordered.size() && overlaps(chunk, ordered.get(i + 1))) {
        upper = (ordered.get(i + 1).startTime() + chunk.endTime()) / 2;
      }

      for (TranscriptionSegment segment : chunk.result().segments()) {
        double absoluteStart = chunk.startTime() + segment.start();
        if (absoluteStart >= lower && absoluteStart < upper) {
          merged.add(segment.shifted(chunk.startTime(), merged.size()));
        } else {
          dropped++;
        }
      }
    }

    LOGGER.debug(
        "Assembled {} segments from {} chunks, dropped {} duplicates from overlaps",
        merged.size(),
        ordered.size(),
        dropped);
    return merged;
  }

  private static boolean overlaps(ChunkTranscript earlier, ChunkTranscript later) {
    return later.chunkIndex() == earlier.chunkIndex() + 1 && earlier.endTime() > later.startTime();
  }
}
