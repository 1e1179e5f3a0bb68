package com.ospicorp.tides.tide.service;

import com.ospicorp.tides.tide.model.Sample;
import com.ospicorp.tides.tide.model.Series;
import com.ospicorp.tides.tide.model.enums.Resolution;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class Resampler {
  private Resampler() {
  }

  /**
   * Left-joins a regular grid at {@code to} resolution (covering the series' span) with the
   * series: each grid instant keeps the sample recorded at exactly that instant, or gets a missing
   * height.
   */
  public static Series resample(Series in, Resolution to) {
    if (in.isEmpty()) return in;
    Map<Instant, Sample> byTime = new HashMap<>(in.size() * 2);
    for (Sample s : in.samples()) {
      byTime.put(s.timestamp(), s);
    }
    List<Instant> grid = TimeGrid.aligned(in.start(), in.end(), to);
    List<Sample> out = new ArrayList<>(grid.size());
    for (Instant t : grid) {
      Sample s = byTime.get(t);
      out.add(s != null ? s : new Sample(t, null));
    }
    return new Series(in.unit(), out);
  }
}
