package com.ospicorp.tides.tide.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ResidualSummary(
    int count,
    double mean,
    double median,
    double max,
    double min,
    @JsonProperty("largest") List<ResidualRecord> largest
) {

  public ResidualSummary {
    largest = List.copyOf(largest);
  }
}
