package com.trendlens.engine.error;

public class ValidationException extends EngineException {

  public static final String CODE = "VALIDATION_ERROR";

  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String code() {
    return CODE;
  }
}
