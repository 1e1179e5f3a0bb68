package com.ospicorp.tides.tide.service;

import com.ospicorp.tides.tide.model.Constituent;
import com.ospicorp.tides.tide.model.ConstituentCatalogue;
import com.ospicorp.tides.tide.model.ConstituentFit;
import com.ospicorp.tides.tide.model.HarmonicModel;
import com.ospicorp.tides.tide.model.Sample;
import com.ospicorp.tides.tide.model.Series;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RRQRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Least-squares harmonic analysis. The model is linear in the unknowns once the constituent speeds
 * are fixed: a constant column for the mean level and a {@code cos(wt)}, {@code sin(wt)} column
 * pair per constituent.
 */
public final class HarmonicFitter {
  private static final Logger log = LoggerFactory.getLogger(HarmonicFitter.class);
  private static final double SINGULARITY_THRESHOLD = 1e-12;

  private HarmonicFitter() {
  }

  public static HarmonicModel fit(Series observed, ConstituentCatalogue catalogue) {
    return fit(observed, catalogue, FitOptions.defaults());
  }

  public static HarmonicModel fit(Series observed, ConstituentCatalogue catalogue,
      FitOptions options) {
    if (options.nodalCorrections()) {
      throw new IllegalArgumentException("Nodal corrections are not supported");
    }
    if (catalogue.isEmpty()) {
      throw new IllegalArgumentException("catalogue must contain at least one constituent");
    }

    List<Sample> usable = observed.withHeights();
    if (usable.isEmpty()) {
      throw new EmptySeriesException("Observed series has no heights to fit");
    }
    int unknowns = 2 * catalogue.size() + 1;
    if (usable.size() < unknowns) {
      throw new InsufficientDataException("Need at least " + unknowns + " observations to fit "
          + catalogue.size() + " constituents, got " + usable.size());
    }

    Instant first = usable.get(0).timestamp();
    Instant last = usable.get(usable.size() - 1).timestamp();
    double spanHours = TimeGrid.hours(Duration.between(first, last));
    Constituent slowest = catalogue.slowest();
    if (spanHours < slowest.periodHours()) {
      throw new InsufficientDataException(String.format(
          "Observations span %.2f h, shorter than one period of %s (%.2f h)",
          spanHours, slowest.name(), slowest.periodHours()));
    }

    int n = usable.size();
    double[] heights = new double[n];
    for (int i = 0; i < n; i++) {
      heights[i] = usable.get(i).height();
    }
    double levelOffset = 0d;
    if (options.subtractMeanSeaLevel()) {
      double[] msl = runningMean(usable, options.meanSeaLevelWindow());
      double sum = 0d;
      for (int i = 0; i < n; i++) {
        heights[i] -= msl[i];
        sum += msl[i];
      }
      levelOffset = sum / n;
    }

    List<Constituent> constituents = catalogue.constituents();
    RealMatrix design = new Array2DRowRealMatrix(n, unknowns);
    for (int i = 0; i < n; i++) {
      double t = TimeGrid.hoursSince(options.epoch(), usable.get(i).timestamp());
      design.setEntry(i, 0, 1d);
      for (int j = 0; j < constituents.size(); j++) {
        double angle = angle(constituents.get(j).speed(), t);
        design.setEntry(i, 1 + 2 * j, Math.cos(angle));
        design.setEntry(i, 2 + 2 * j, Math.sin(angle));
      }
    }

    RRQRDecomposition qr = new RRQRDecomposition(design, SINGULARITY_THRESHOLD);
    int rank = qr.getRank(options.rankTolerance());
    if (rank < unknowns) {
      throw new InsufficientDataException("Design matrix has rank " + rank + " of " + unknowns
          + "; the record cannot separate the requested constituents");
    }
    RealVector solution;
    try {
      solution = qr.getSolver().solve(new ArrayRealVector(heights, false));
    } catch (SingularMatrixException ex) {
      throw new InsufficientDataException("Least-squares system is singular", ex);
    }

    List<ConstituentFit> fits = new ArrayList<>(constituents.size());
    for (int j = 0; j < constituents.size(); j++) {
      Constituent c = constituents.get(j);
      double a = solution.getEntry(1 + 2 * j);
      double b = solution.getEntry(2 + 2 * j);
      fits.add(new ConstituentFit(c.name(), c.speed(), Math.hypot(a, b),
          normalizeDegrees(Math.toDegrees(Math.atan2(b, a)))));
    }
    double meanLevel = solution.getEntry(0) + levelOffset;
    log.debug("Fitted {} constituents to {} observations between {} and {} (mean level {})",
        fits.size(), n, first, last, meanLevel);
    return new HarmonicModel(meanLevel, fits, first, last, options.epoch(), observed.unit());
  }

  /** Constituent argument {@code speed * t} in radians, reduced modulo a full cycle. */
  static double angle(double speedDegPerHour, double hours) {
    return Math.toRadians((speedDegPerHour * hours) % 360d);
  }

  static double normalizeDegrees(double degrees) {
    double d = degrees % 360d;
    return d < 0d ? d + 360d : d;
  }

  private static double[] runningMean(List<Sample> samples, Duration window) {
    Duration half = window.dividedBy(2);
    int n = samples.size();
    double[] out = new double[n];
    int lo = 0;
    int hi = 0;
    double sum = 0d;
    for (int i = 0; i < n; i++) {
      Instant t = samples.get(i).timestamp();
      while (hi < n && !samples.get(hi).timestamp().isAfter(t.plus(half))) {
        sum += samples.get(hi).height();
        hi++;
      }
      while (samples.get(lo).timestamp().isBefore(t.minus(half))) {
        sum -= samples.get(lo).height();
        lo++;
      }
      out[i] = sum / (hi - lo);
    }
    return out;
  }
}
