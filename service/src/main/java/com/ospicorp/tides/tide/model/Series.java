package com.ospicorp.tides.tide.model;

import com.ospicorp.tides.tide.model.enums.HeightUnit;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable water-level series in a single height unit. Timestamps are strictly increasing;
 * callers deduplicate before building a series.
 */
public record Series(HeightUnit unit, List<Sample> samples) {

  public Series {
    Objects.requireNonNull(unit, "unit");
    samples = List.copyOf(samples);
    for (int i = 1; i < samples.size(); i++) {
      Instant prev = samples.get(i - 1).timestamp();
      Instant cur = samples.get(i).timestamp();
      if (!cur.isAfter(prev)) {
        throw new IllegalArgumentException("Series timestamps must be strictly increasing: "
            + cur + " follows " + prev);
      }
    }
  }

  public static Series empty(HeightUnit unit) {
    return new Series(unit, List.of());
  }

  public int size() {
    return samples.size();
  }

  public boolean isEmpty() {
    return samples.isEmpty();
  }

  public Instant start() {
    return samples.isEmpty() ? null : samples.get(0).timestamp();
  }

  public Instant end() {
    return samples.isEmpty() ? null : samples.get(samples.size() - 1).timestamp();
  }

  public Duration span() {
    return samples.isEmpty() ? Duration.ZERO : Duration.between(start(), end());
  }

  /** Time from the first to the last sample that carries a height; zero when none or one does. */
  public Duration heightSpan() {
    Instant first = null;
    Instant last = null;
    for (Sample s : samples) {
      if (s.hasHeight()) {
        if (first == null) {
          first = s.timestamp();
        }
        last = s.timestamp();
      }
    }
    return first == null ? Duration.ZERO : Duration.between(first, last);
  }

  /** Samples that carry a height, in order. */
  public List<Sample> withHeights() {
    List<Sample> out = new ArrayList<>(samples.size());
    for (Sample s : samples) {
      if (s.hasHeight()) {
        out.add(s);
      }
    }
    return out;
  }

  public List<Instant> timestamps() {
    List<Instant> out = new ArrayList<>(samples.size());
    for (Sample s : samples) {
      out.add(s.timestamp());
    }
    return out;
  }
}
