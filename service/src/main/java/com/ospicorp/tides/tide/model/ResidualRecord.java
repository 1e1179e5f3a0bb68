package com.ospicorp.tides.tide.model;

import com.ospicorp.tides.tide.model.enums.TideKind;
import java.time.Instant;
import java.util.Objects;

public record ResidualRecord(
    Instant timestamp,
    double observed,
    double predicted,
    double residual,
    TideKind kind
) {

  public ResidualRecord {
    Objects.requireNonNull(timestamp, "timestamp");
    if (Double.compare(residual, observed - predicted) != 0) {
      throw new IllegalArgumentException("residual " + residual + " at " + timestamp
          + " is not observed - predicted (" + (observed - predicted) + ")");
    }
  }

  public static ResidualRecord of(Instant timestamp, double observed, double predicted,
      TideKind kind) {
    return new ResidualRecord(timestamp, observed, predicted, observed - predicted, kind);
  }
}
