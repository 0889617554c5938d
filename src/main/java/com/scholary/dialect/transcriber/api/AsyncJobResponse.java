package com.scholary.dialect.transcriber.api;

/**
 * Response for async transcription request.
 *
 * <p>Returns a job ID and the URL to poll for status.
 */
public record AsyncJobResponse(String jobId, String statusUrl) {}
