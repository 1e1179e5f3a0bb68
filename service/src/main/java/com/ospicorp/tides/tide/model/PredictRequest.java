package com.ospicorp.tides.tide.model;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.Instant;

public record PredictRequest(
    @NotNull HarmonicModel model,
    @NotNull Instant start,
    @NotNull Instant end,
    Duration step,
    String resolution
) {}
