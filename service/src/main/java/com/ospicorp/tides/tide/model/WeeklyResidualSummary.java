package com.ospicorp.tides.tide.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Optional;

/**
 * Residual statistics of one calendar week. {@code stats} is null when no observation of the week
 * could be matched to a prediction ("no data").
 */
public record WeeklyResidualSummary(
    WeekKey week,
    @JsonProperty("high_count") int highCount,
    @JsonProperty("low_count") int lowCount,
    ResidualSummary stats
) {

  @JsonProperty("has_data")
  public boolean hasData() {
    return stats != null;
  }

  @JsonIgnore
  public Optional<ResidualSummary> summary() {
    return Optional.ofNullable(stats);
  }
}
