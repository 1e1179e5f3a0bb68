package com.ospicorp.tides.tide.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record PredictionResponse(
    String unit,
    @JsonProperty("point_count") int pointCount,
    List<Sample> points,
    List<ExtremaEvent> extrema
) {}
