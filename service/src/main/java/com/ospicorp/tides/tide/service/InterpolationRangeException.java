package com.ospicorp.tides.tide.service;

import java.time.Instant;

public class InterpolationRangeException extends TideAnalysisException {
  private final Instant requested;

  public InterpolationRangeException(Instant requested, Instant from, Instant to) {
    super("Timestamp " + requested + " lies outside the interpolation range [" + from + ", " + to
        + "]");
    this.requested = requested;
  }

  public Instant requested() {
    return requested;
  }
}
