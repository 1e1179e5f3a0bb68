package com.ospicorp.tides.tide.model.enums;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

public enum Resolution {
  MINUTE(ChronoUnit.MINUTES),
  HOUR(ChronoUnit.HOURS);

  private final ChronoUnit unit;

  Resolution(ChronoUnit unit) {
    this.unit = unit;
  }

  public ChronoUnit unit() {
    return unit;
  }

  public Duration step() {
    return unit.getDuration();
  }
}
