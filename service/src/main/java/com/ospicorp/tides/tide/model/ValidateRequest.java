package com.ospicorp.tides.tide.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record ValidateRequest(
    @NotNull @Valid SeriesPayload gauge,
    @NotNull @Valid SeriesPayload reference,
    String mode,
    @JsonProperty("max_distance") Duration maxDistance,
    @JsonProperty("top_n") Integer topN,
    List<String> constituents,
    Instant start,
    Instant end
) {}
