package com.example.tool_gateway.api;

import com.example.tool_gateway.cache.UpstreamFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ToolApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ToolApiExceptionHandler.class);

  @ExceptionHandler(UpstreamFetchException.class)
  public ResponseEntity<ApiErrorResponse> handleUpstreamFetch(UpstreamFetchException ex) {
    logger.warn("manual cache refresh failed reason={}", ex.reason());
    if (ex.reason() == UpstreamFetchException.Reason.TIMEOUT) {
      return error(HttpStatus.GATEWAY_TIMEOUT, "CACHE_REFRESH_TIMEOUT", ex.getMessage());
    }
    return error(HttpStatus.BAD_GATEWAY, "CACHE_REFRESH_FAILED", ex.getMessage());
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    return error(
        HttpStatus.BAD_REQUEST,
        "TOOL_BAD_REQUEST",
        "missing parameter: " + ex.getParameterName());
  }

  private ResponseEntity<ApiErrorResponse> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(new ApiErrorResponse(code, message));
  }
}
