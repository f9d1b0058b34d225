package com.scholary.audiobook.api;

/**
 * Response for an accepted synthesis request.
 *
 * <p>Returns a job ID and the URL to poll for status.
 */
public record AsyncJobResponse(String jobId, String statusUrl) {}
