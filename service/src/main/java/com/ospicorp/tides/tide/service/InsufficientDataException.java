package com.ospicorp.tides.tide.service;

public class InsufficientDataException extends TideAnalysisException {

  public InsufficientDataException(String message) {
    super(message);
  }

  public InsufficientDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
