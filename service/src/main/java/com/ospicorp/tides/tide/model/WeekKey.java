package com.ospicorp.tides.tide.model;

import java.util.Comparator;

public record WeekKey(int year, int week) implements Comparable<WeekKey> {

  private static final Comparator<WeekKey> ORDER =
      Comparator.comparingInt(WeekKey::year).thenComparingInt(WeekKey::week);

  @Override
  public int compareTo(WeekKey other) {
    return ORDER.compare(this, other);
  }
}
