package com.ospicorp.tides.tide.model;

import java.time.Duration;
import java.time.Instant;

// reference is null when nothing lies within the configured distance
public record NearestMatch(Sample observation, Sample reference, Duration offset) {

  public boolean matched() {
    return reference != null;
  }

  public Instant timestamp() {
    return observation.timestamp();
  }
}
