package com.ospicorp.tides.tide.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

// speed in degrees per solar hour
@JsonPropertyOrder({"name", "speed"})
public record Constituent(String name, double speed) {

  public Constituent {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Constituent name must be provided");
    }
    if (!(speed > 0d) || Double.isInfinite(speed)) {
      throw new IllegalArgumentException("Constituent " + name + " must have a positive speed, got "
          + speed);
    }
  }

  /** Period in hours. */
  public double periodHours() {
    return 360d / speed;
  }
}
