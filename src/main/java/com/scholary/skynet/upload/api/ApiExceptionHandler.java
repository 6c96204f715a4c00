package com.scholary.skynet.upload.api;

import com.scholary.skynet.upload.skylink.MalformedSkylinkException;
import com.scholary.skynet.upload.transport.TransportException;
import com.scholary.skynet.upload.upload.UploadCancelledException;
import com.scholary.skynet.upload.upload.UploadFailedException;
import com.scholary.skynet.upload.upload.UploadIncompleteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps upload errors to HTTP responses. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({IllegalArgumentException.class, MalformedSkylinkException.class})
  public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException e) {
    LOGGER.warn("Rejected request: {}", e.getMessage());
    return respond(HttpStatus.BAD_REQUEST, e);
  }

  @ExceptionHandler({
    TransportException.class,
    UploadFailedException.class,
    UploadIncompleteException.class
  })
  public ResponseEntity<ErrorResponse> handlePortalFailure(RuntimeException e) {
    LOGGER.error("Portal upload failed: {}", e.getMessage(), e);
    return respond(HttpStatus.BAD_GATEWAY, e);
  }

  @ExceptionHandler(UploadCancelledException.class)
  public ResponseEntity<ErrorResponse> handleCancelled(UploadCancelledException e) {
    LOGGER.info("Upload cancelled: {}", e.getMessage());
    return respond(HttpStatus.CONFLICT, e);
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<ErrorResponse> handleRejected(TaskRejectedException e) {
    LOGGER.warn("Upload queue is full: {}", e.getMessage());
    return respond(HttpStatus.SERVICE_UNAVAILABLE, e);
  }

  private static ResponseEntity<ErrorResponse> respond(HttpStatus status, Exception e) {
    return ResponseEntity.status(status)
        .body(new ErrorResponse(status.getReasonPhrase(), e.getMessage()));
  }
}
