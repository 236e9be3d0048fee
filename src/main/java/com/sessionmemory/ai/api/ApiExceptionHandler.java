package com.sessionmemory.ai.api;

import com.sessionmemory.ai.memory.InvalidSessionIdException;
import com.sessionmemory.ai.memory.SessionBusyException;
import com.sessionmemory.ai.memory.SessionClosedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.client.RestClientException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String RETRY_AFTER_SECONDS = "1";

  @ExceptionHandler(InvalidSessionIdException.class)
  public ResponseEntity<ApiErrorResponse> invalidSession(InvalidSessionIdException e) {
    return ResponseEntity.badRequest().body(ApiErrorResponse.error(e.getMessage()));
  }

  @ExceptionHandler(SessionBusyException.class)
  public ResponseEntity<ApiErrorResponse> sessionBusy(SessionBusyException e) {
    log.warn("Session busy sessionId={}", e.getSessionId());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
        .body(ApiErrorResponse.error("Session is busy, retry shortly", e.getSessionId()));
  }

  @ExceptionHandler(SessionClosedException.class)
  public ResponseEntity<ApiErrorResponse> sessionClosed(SessionClosedException e) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(ApiErrorResponse.error("Session was closed during the exchange", e.getSessionId()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> badRequest(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(ApiErrorResponse.error(e.getMessage()));
  }

  @ExceptionHandler({RestClientException.class, TransientAiException.class, NonTransientAiException.class})
  public ResponseEntity<ApiErrorResponse> modelUnavailable(RuntimeException e) {
    log.warn("Language model call failed", e);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(ApiErrorResponse.error("Language model call failed", e.getMessage()));
  }
}
