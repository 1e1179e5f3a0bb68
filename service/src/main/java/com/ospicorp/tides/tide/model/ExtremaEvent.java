package com.ospicorp.tides.tide.model;

import com.ospicorp.tides.tide.model.enums.TideKind;
import java.time.Instant;

public record ExtremaEvent(Instant timestamp, double height, TideKind kind) {

  public Sample toSample() {
    return new Sample(timestamp, height, kind);
  }
}
