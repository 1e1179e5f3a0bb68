package com.ospicorp.tides.tide.service;

import com.ospicorp.tides.tide.model.ConstituentFit;
import com.ospicorp.tides.tide.model.HarmonicModel;
import com.ospicorp.tides.tide.model.Sample;
import com.ospicorp.tides.tide.model.Series;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a {@link HarmonicModel} on a time grid. Instants outside the fitting window are
 * extrapolated.
 */
public final class TidePredictor {
  private static final Logger log = LoggerFactory.getLogger(TidePredictor.class);

  private TidePredictor() {
  }

  public static Series predict(HarmonicModel model, Instant start, Instant end, Duration step) {
    return predict(model, TimeGrid.regular(start, end, step));
  }

  public static Series predict(HarmonicModel model, List<Instant> grid) {
    List<Sample> out = new ArrayList<>(grid.size());
    Instant prev = null;
    int outside = 0;
    for (Instant t : grid) {
      if (prev != null && !t.isAfter(prev)) {
        throw new IllegalArgumentException("Prediction grid must be strictly increasing at " + t);
      }
      if (!model.covers(t)) {
        outside++;
      }
      out.add(new Sample(t, heightAt(model, t)));
      prev = t;
    }
    if (outside > 0) {
      log.debug("Extrapolating {} of {} instants outside the fitting window [{}, {}]",
          outside, grid.size(), model.fitStart(), model.fitEnd());
    }
    return new Series(model.unit(), out);
  }

  public static double heightAt(HarmonicModel model, Instant t) {
    double hours = TimeGrid.hoursSince(model.epoch(), t);
    double h = model.meanLevel();
    for (ConstituentFit c : model.constituents()) {
      h += c.amplitude() * Math.cos(HarmonicFitter.angle(c.speed(), hours)
          - Math.toRadians(c.phase()));
    }
    return h;
  }
}
