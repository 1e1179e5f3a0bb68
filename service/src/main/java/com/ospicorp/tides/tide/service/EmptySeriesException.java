package com.ospicorp.tides.tide.service;

public class EmptySeriesException extends TideAnalysisException {

  public EmptySeriesException(String message) {
    super(message);
  }
}
