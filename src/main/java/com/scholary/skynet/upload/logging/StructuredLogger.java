package com.scholary.skynet.upload.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each upload event sets a handful of MDC fields for the duration of one log call, so log
 * shippers can index sessions and parts without parsing messages.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log session started event. */
  public void logSessionStarted(int partIndex, long start, long end, boolean partial) {
    try {
      MDC.put("event_type", "session_started");
      MDC.put("part_index", String.valueOf(partIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("partial", String.valueOf(partial));

      logger.debug(
          "Session started: part={}, range=[{}-{}), partial={}", partIndex, start, end, partial);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk sent event. */
  public void logChunkSent(int partIndex, long offset, long newOffset, long sendMs) {
    try {
      MDC.put("event_type", "chunk_sent");
      MDC.put("part_index", String.valueOf(partIndex));
      MDC.put("offset", String.valueOf(offset));
      MDC.put("newOffset", String.valueOf(newOffset));
      MDC.put("sendMs", String.valueOf(sendMs));

      logger.debug(
          "Chunk sent: part={}, offset={}, newOffset={}, send={}ms",
          partIndex,
          offset,
          newOffset,
          sendMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log session retry event. */
  public void logSessionRetry(
      int partIndex, int attempt, int maxRetries, long delayMs, int statusCode, String message) {
    try {
      MDC.put("event_type", "session_retry");
      MDC.put("part_index", String.valueOf(partIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("statusCode", String.valueOf(statusCode));

      logger.warn(
          "Session retry: part={}, attempt={}/{}, delay={}ms, status={}, message={}",
          partIndex,
          attempt,
          maxRetries,
          delayMs,
          statusCode,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log session failure event. */
  public void logSessionFailed(int partIndex, int statusCode, String message) {
    try {
      MDC.put("event_type", "session_failed");
      MDC.put("part_index", String.valueOf(partIndex));
      MDC.put("statusCode", String.valueOf(statusCode));

      logger.error(
          "Session failed: part={}, status={}, message={}", partIndex, statusCode, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log session finished event. */
  public void logSessionFinished(int partIndex, long bytes, long elapsedMs) {
    try {
      MDC.put("event_type", "session_finished");
      MDC.put("part_index", String.valueOf(partIndex));
      MDC.put("bytes", String.valueOf(bytes));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Session finished: part={}, bytes={}, elapsed={}ms", partIndex, bytes, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log upload progress event. */
  public void logUploadProgress(String jobId, long bytesUploaded, long bytesTotal, int percent) {
    try {
      MDC.put("event_type", "upload_progress");
      MDC.put("bytesUploaded", String.valueOf(bytesUploaded));
      MDC.put("bytesTotal", String.valueOf(bytesTotal));
      MDC.put("percentComplete", String.valueOf(percent));

      logger.info(
          "Upload progress: jobId={}, bytes={}/{}, progress={}%",
          jobId, bytesUploaded, bytesTotal, percent);
    } finally {
      clearEventFields();
    }
  }

  /** Set upload context in MDC. */
  public static void setUploadContext(String uploadId, String filename) {
    MDC.put("uploadId", uploadId);
    MDC.put("filename", filename);
  }

  /** Clear upload context from MDC. */
  public static void clearUploadContext() {
    MDC.remove("uploadId");
    MDC.remove("filename");
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put("jobId", jobId);
  }

  public static void clearJobContext() {
    MDC.remove("jobId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("part_index");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("partial");
    MDC.remove("offset");
    MDC.remove("newOffset");
    MDC.remove("sendMs");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
    MDC.remove("statusCode");
    MDC.remove("bytes");
    MDC.remove("elapsedMs");
    MDC.remove("bytesUploaded");
    MDC.remove("bytesTotal");
    MDC.remove("percentComplete");
  }
}
