package com.scholary.transcriber.job;

import com.scholary.transcriber.transcription.TranscriptionResult;

/**
 * Transcription of one audio chunk, with timestamps still relative to the chunk.
 *
 * <p>Tracks the chunk's position in the original file so segments can be moved to absolute time
 * during assembly.
 */
record ChunkTranscript(int chunkIndex, double startTime, double endTime, TranscriptionResult result) {}
