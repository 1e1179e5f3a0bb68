package com.ospicorp.tides.tide.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;

public record FitRequest(
    @NotNull @Valid SeriesPayload series,
    List<String> constituents,
    Instant epoch,
    @JsonProperty("subtract_mean_sea_level") boolean subtractMeanSeaLevel,
    @JsonProperty("nodal_corrections") boolean nodalCorrections
) {}
