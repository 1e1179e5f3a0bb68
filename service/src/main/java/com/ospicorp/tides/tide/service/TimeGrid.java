package com.ospicorp.tides.tide.service;

import com.ospicorp.tides.tide.model.enums.Resolution;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class TimeGrid {
  private static final double SECONDS_PER_HOUR = 3600d;

  private TimeGrid() {
  }

  /** Instants {@code start, start + step, ...} up to and including {@code end}. */
  public static List<Instant> regular(Instant start, Instant end, Duration step) {
    long count = count(start, end, step);
    if (count > Integer.MAX_VALUE - 8) {
      throw new IllegalArgumentException("Grid of " + count + " points is too large");
    }
    List<Instant> out = new ArrayList<>((int) count);
    for (long i = 0; i < count; i++) {
      out.add(start.plus(step.multipliedBy(i)));
    }
    return out;
  }

  /** Number of instants {@link #regular} would return, without building them. */
  public static long count(Instant start, Instant end, Duration step) {
    if (step == null || step.isZero() || step.isNegative()) {
      throw new IllegalArgumentException("step must be positive");
    }
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("start must be before or equal to end");
    }
    return Duration.between(start, end).dividedBy(step) + 1;
  }

  /** Whole minutes or hours between {@code start} and {@code end}, both rounded inwards. */
  public static List<Instant> aligned(Instant start, Instant end, Resolution resolution) {
    Instant first = ceil(start, resolution);
    Instant last = end.truncatedTo(resolution.unit());
    if (last.isBefore(first)) {
      return List.of();
    }
    return regular(first, last, resolution.step());
  }

  public static Instant ceil(Instant t, Resolution resolution) {
    Instant floor = t.truncatedTo(resolution.unit());
    return floor.equals(t) ? t : floor.plus(resolution.step());
  }

  /** Elapsed hours from {@code epoch} to {@code t}, negative before the epoch. */
  public static double hoursSince(Instant epoch, Instant t) {
    Duration d = Duration.between(epoch, t);
    return (d.getSeconds() + d.getNano() / 1_000_000_000d) / SECONDS_PER_HOUR;
  }

  public static double hours(Duration d) {
    return (d.getSeconds() + d.getNano() / 1_000_000_000d) / SECONDS_PER_HOUR;
  }
}
