package com.sessionmemory.ai.api;

/**
 * JSON error payload returned by the chat endpoints.
 *
 * @param status always "error"
 * @param message user-facing error message
 * @param details optional diagnostic details, may be null
 */
public record ApiErrorResponse(String status, String message, String details) {

  public static ApiErrorResponse error(String message) {
    return new ApiErrorResponse("error", message, null);
  }

  public static ApiErrorResponse error(String message, String details) {
    return new ApiErrorResponse("error", message, details);
  }
}
