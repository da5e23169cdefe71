package com.trendlens.engine.error;

/**
 * Base type for every failure the engine raises. Each subclass carries a stable {@link #code()} so a
 * transport layer can distinguish "nothing found" from "bad request" without parsing messages.
 */
public abstract class EngineException extends RuntimeException {

  protected EngineException(String message) {
    super(message);
  }

  protected EngineException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract String code();
}
