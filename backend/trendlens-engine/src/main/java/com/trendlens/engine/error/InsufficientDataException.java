package com.trendlens.engine.error;

public class InsufficientDataException extends EngineException {

  public InsufficientDataException(String message) {
    super(message);
  }

  @Override
  public String code() {
    return "INSUFFICIENT_DATA";
  }
}
