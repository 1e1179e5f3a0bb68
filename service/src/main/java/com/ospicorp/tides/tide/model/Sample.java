package com.ospicorp.tides.tide.model;

import com.ospicorp.tides.tide.model.enums.TideKind;
import java.time.Instant;
import java.util.Objects;

// A null height is "no data", never zero. kind is only set on digitized high/low rows.
public record Sample(Instant timestamp, Double height, TideKind kind) {

  public Sample {
    Objects.requireNonNull(timestamp, "timestamp");
  }

  public Sample(Instant timestamp, Double height) {
    this(timestamp, height, null);
  }

  public boolean hasHeight() {
    return height != null && !height.isNaN();
  }
}
