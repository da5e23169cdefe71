package com.trendlens.api.controller;

import com.trendlens.api.model.ApiError;
import com.trendlens.engine.error.EmptyRangeException;
import com.trendlens.engine.error.EngineException;
import com.trendlens.engine.error.InsufficientDataException;
import com.trendlens.engine.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps engine failures to {@code {code, message}} bodies. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({ValidationException.class, EmptyRangeException.class})
  public ResponseEntity<ApiError> badRequest(EngineException e) {
    log.debug("Rejected request: {}", e.getMessage());
    return respond(HttpStatus.BAD_REQUEST, e.code(), e.getMessage());
  }

  @ExceptionHandler(InsufficientDataException.class)
  public ResponseEntity<ApiError> insufficient(InsufficientDataException e) {
    return respond(HttpStatus.NOT_FOUND, e.code(), e.getMessage());
  }

  @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class,
      HttpMessageNotReadableException.class})
  public ResponseEntity<ApiError> malformed(Exception e) {
    return respond(HttpStatus.BAD_REQUEST, ValidationException.CODE, e.getMessage());
  }

  private static ResponseEntity<ApiError> respond(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status).body(new ApiError(code, message));
  }
}
