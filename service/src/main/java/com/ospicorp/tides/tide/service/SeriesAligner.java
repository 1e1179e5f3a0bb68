package com.ospicorp.tides.tide.service;

import com.ospicorp.tides.tide.model.NearestMatch;
import com.ospicorp.tides.tide.model.Sample;
import com.ospicorp.tides.tide.model.Series;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps one series onto the timestamps of another, either by spline interpolation over a dense
 * reference or by pairing each observation with the closest reference event.
 */
public final class SeriesAligner {

  private SeriesAligner() {
  }

  /**
   * Values of a not-a-knot cubic spline through {@code dense}, evaluated at every timestamp of
   * {@code sparse}. The result is in the dense series' unit and keeps the sparse samples' kind
   * tags.
   *
   * @throws InterpolationRangeException if a sparse timestamp lies outside the dense series
   * @throws InconsistentUnitsException  if the two series use different height units
   */
  public static Series interpolate(Series sparse, Series dense) {
    InconsistentUnitsException.check(sparse.unit(), dense.unit());
    if (sparse.isEmpty()) {
      return Series.empty(dense.unit());
    }
    List<Sample> knots = dense.withHeights();
    if (knots.isEmpty()) {
      throw new EmptySeriesException("Reference series has no heights to interpolate");
    }
    Instant origin = knots.get(0).timestamp();
    double[] x = new double[knots.size()];
    double[] y = new double[knots.size()];
    for (int i = 0; i < knots.size(); i++) {
      x[i] = TimeGrid.hoursSince(origin, knots.get(i).timestamp());
      y[i] = knots.get(i).height();
    }
    Instant last = knots.get(knots.size() - 1).timestamp();
    NotAKnotSpline spline = NotAKnotSpline.interpolate(x, y);

    List<Sample> out = new ArrayList<>(sparse.size());
    for (Sample s : sparse.samples()) {
      double at = TimeGrid.hoursSince(origin, s.timestamp());
      if (!spline.isInRange(at)) {
        throw new InterpolationRangeException(s.timestamp(), origin, last);
      }
      out.add(new Sample(s.timestamp(), spline.value(at), s.kind()));
    }
    return new Series(dense.unit(), out);
  }

  public static List<NearestMatch> matchNearest(Series references, Series observations) {
    return matchNearest(references, observations, null);
  }

  /**
   * Pairs each observation with the reference whose timestamp is closest; equidistant references
   * resolve to the earlier one. Observations farther than {@code maxDistance} from every reference
   * stay unmatched. A null {@code maxDistance} means no cutoff; a negative one is rejected.
   */
  public static List<NearestMatch> matchNearest(Series references, Series observations,
      Duration maxDistance) {
    if (maxDistance != null && maxDistance.isNegative()) {
      throw new IllegalArgumentException("maxDistance must not be negative, got " + maxDistance);
    }
    InconsistentUnitsException.check(references.unit(), observations.unit());
    List<NearestMatch> out = new ArrayList<>(observations.size());
    if (observations.isEmpty()) {
      return out;
    }
    List<Sample> refs = references.withHeights();
    if (refs.isEmpty()) {
      throw new EmptySeriesException("No reference events to match observations against");
    }

    for (Sample obs : observations.samples()) {
      Sample best = closest(refs, obs.timestamp());
      Duration offset = Duration.between(best.timestamp(), obs.timestamp());
      if (maxDistance != null && offset.abs().compareTo(maxDistance) > 0) {
        out.add(new NearestMatch(obs, null, offset));
      } else {
        out.add(new NearestMatch(obs, best, offset));
      }
    }
    return out;
  }

  public static Series alignNearest(Series references, Series observations) {
    return alignNearest(references, observations, null);
  }

  /**
   * {@link #matchNearest} as a series at the observation timestamps carrying the matched
   * reference heights; unmatched observations get a missing height.
   */
  public static Series alignNearest(Series references, Series observations, Duration maxDistance) {
    List<NearestMatch> matches = matchNearest(references, observations, maxDistance);
    List<Sample> out = new ArrayList<>(matches.size());
    for (NearestMatch m : matches) {
      Double height = m.matched() ? m.reference().height() : null;
      out.add(new Sample(m.timestamp(), height, m.observation().kind()));
    }
    return new Series(references.unit(), out);
  }

  private static Sample closest(List<Sample> refs, Instant t) {
    int lo = 0;
    int hi = refs.size();
    // first index with timestamp >= t
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (refs.get(mid).timestamp().isBefore(t)) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    if (lo == 0) {
      return refs.get(0);
    }
    if (lo == refs.size()) {
      return refs.get(refs.size() - 1);
    }
    Sample before = refs.get(lo - 1);
    Sample after = refs.get(lo);
    Duration toBefore = Duration.between(before.timestamp(), t);
    Duration toAfter = Duration.between(t, after.timestamp());
    return toAfter.compareTo(toBefore) < 0 ? after : before;
  }
}
