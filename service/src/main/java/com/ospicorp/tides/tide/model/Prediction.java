package com.ospicorp.tides.tide.model;

import java.util.List;
import java.util.Locale;

// extrema are detected on the dense series, before any resampling of it
public record Prediction(Series series, List<ExtremaEvent> extrema) {

  public PredictionResponse toResponse() {
    return new PredictionResponse(series.unit().name().toLowerCase(Locale.ROOT),
        series.size(), series.samples(), extrema);
  }
}
