package com.ospicorp.tides.tide.service;

/** Deterministic failure of an analysis stage on invalid or inadequate input. */
public abstract class TideAnalysisException extends RuntimeException {

  protected TideAnalysisException(String message) {
    super(message);
  }

  protected TideAnalysisException(String message, Throwable cause) {
    super(message, cause);
  }
}
