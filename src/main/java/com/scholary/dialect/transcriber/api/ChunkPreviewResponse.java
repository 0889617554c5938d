package com.scholary.dialect.transcriber.api;

import com.scholary.dialect.transcriber.chunking.ChunkBoundary;
import java.util.List;

/**
 * Response for chunk preview request.
 *
 * <p>Shows how the audio will be split without decoding it.
 */
public record ChunkPreviewResponse(
    double totalDurationSeconds,
    double chunkDurationSeconds,
    double overlapSeconds,
    int chunkCount,
    List<ChunkBoundary> chunks) {}
