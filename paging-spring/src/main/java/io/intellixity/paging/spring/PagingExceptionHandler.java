package io.intellixity.paging.spring;

import io.intellixity.paging.paging.PagingParameterException;
import io.intellixity.paging.query.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps rejected paging requests to {@code 400 {"success": false, "message": ...}}.
 */
@RestControllerAdvice
public class PagingExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(PagingExceptionHandler.class);

  @ExceptionHandler(PagingParameterException.class)
  public ResponseEntity<ErrorResponse> handlePagingParameter(PagingParameterException ex) {
    log.warn("paging.rejected parameter={} message={}", ex.parameter(), ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.of(ex.getMessage()));
  }

  @ExceptionHandler(QueryValidationException.class)
  public ResponseEntity<ErrorResponse> handleQueryValidation(QueryValidationException ex) {
    log.warn("paging.invalid_query message={}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.of(ex.getMessage()));
  }
}
