package com.scholary.transcriber.api;

import com.scholary.transcriber.store.StoredSegment;
import com.scholary.transcriber.store.TranscriptRecord;
import java.util.List;

/** A persisted transcript with its segments ordered by start time. */
public record TranscriptResponse(TranscriptRecord transcript, List<StoredSegment> segments) {}
