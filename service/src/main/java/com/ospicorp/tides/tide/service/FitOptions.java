package com.ospicorp.tides.tide.service;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Options for {@link HarmonicFitter}.
 *
 * @param epoch                 origin of the model's time axis
 * @param subtractMeanSeaLevel  remove a centred running mean before fitting
 * @param meanSeaLevelWindow    width of that running mean
 * @param nodalCorrections      18.6-year amplitude/phase modulation; not supported, must stay off
 * @param rankTolerance         drop threshold of the rank-revealing QR used to reject degenerate
 *                              designs
 */
public record FitOptions(
    Instant epoch,
    boolean subtractMeanSeaLevel,
    Duration meanSeaLevelWindow,
    boolean nodalCorrections,
    double rankTolerance
) {
  public static final Instant DEFAULT_EPOCH = Instant.EPOCH;
  public static final Duration DEFAULT_MSL_WINDOW = Duration.ofDays(30);
  public static final double DEFAULT_RANK_TOLERANCE = 1e-6;

  public FitOptions {
    Objects.requireNonNull(epoch, "epoch");
    Objects.requireNonNull(meanSeaLevelWindow, "meanSeaLevelWindow");
    if (meanSeaLevelWindow.isNegative() || meanSeaLevelWindow.isZero()) {
      throw new IllegalArgumentException("meanSeaLevelWindow must be positive");
    }
    if (!(rankTolerance > 0d)) {
      throw new IllegalArgumentException("rankTolerance must be positive");
    }
  }

  public static FitOptions defaults() {
    return new FitOptions(DEFAULT_EPOCH, false, DEFAULT_MSL_WINDOW, false, DEFAULT_RANK_TOLERANCE);
  }

  public FitOptions withSubtractMeanSeaLevel(boolean enabled) {
    return new FitOptions(epoch, enabled, meanSeaLevelWindow, nodalCorrections, rankTolerance);
  }

  public FitOptions withNodalCorrections(boolean enabled) {
    return new FitOptions(epoch, subtractMeanSeaLevel, meanSeaLevelWindow, enabled, rankTolerance);
  }

  public FitOptions withEpoch(Instant newEpoch) {
    return new FitOptions(newEpoch, subtractMeanSeaLevel, meanSeaLevelWindow, nodalCorrections,
        rankTolerance);
  }
}
