package com.ospicorp.tides.tide.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record SeriesPayload(
    @NotNull @Schema(description = "Height unit of every sample", example = "meters") String unit,
    @NotNull @Valid List<SamplePayload> samples
) {}
