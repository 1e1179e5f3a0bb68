package com.ospicorp.tides.tide.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

public record SamplePayload(
    @NotNull @Schema(example = "2021-06-01T00:00:00Z") Instant timestamp,
    @Schema(description = "Height; null when no value was recorded", example = "1.23") Double height,
    @Schema(description = "Optional high/low label (h, l, high, low)", example = "h") String kind
) {}
