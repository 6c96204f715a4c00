package com.scholary.skynet.upload.api;

/**
 * Response for an async upload request.
 *
 * <p>Returns a job ID that can be used to poll for status or cancel the upload.
 */
public record AsyncJobResponse(String jobId) {}
