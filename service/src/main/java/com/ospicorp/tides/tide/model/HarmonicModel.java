package com.ospicorp.tides.tide.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.tides.tide.model.enums.HeightUnit;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Fitted tide model: {@code h(t) = meanLevel + sum(A_i * cos(speed_i * t - phase_i))} with
 * {@code t} in hours since {@code epoch}. {@code fitStart}/{@code fitEnd} bound the observations
 * the model was derived from.
 */
public record HarmonicModel(
    @JsonProperty("mean_level") double meanLevel,
    List<ConstituentFit> constituents,
    @JsonProperty("fit_start") Instant fitStart,
    @JsonProperty("fit_end") Instant fitEnd,
    Instant epoch,
    HeightUnit unit
) {

  public HarmonicModel {
    Objects.requireNonNull(epoch, "epoch");
    Objects.requireNonNull(unit, "unit");
    constituents = List.copyOf(constituents);
    for (ConstituentFit c : constituents) {
      if (c.amplitude() < 0d) {
        throw new IllegalArgumentException("Negative amplitude for constituent " + c.name());
      }
    }
  }

  public boolean covers(Instant t) {
    return fitStart != null && fitEnd != null && !t.isBefore(fitStart) && !t.isAfter(fitEnd);
  }
}
