package com.ospicorp.tides.tide.service;

import com.ospicorp.tides.tide.model.ResidualRecord;
import com.ospicorp.tides.tide.model.ResidualSummary;
import com.ospicorp.tides.tide.model.Sample;
import com.ospicorp.tides.tide.model.Series;
import com.ospicorp.tides.tide.model.WeekKey;
import com.ospicorp.tides.tide.model.WeeklyResidualSummary;
import com.ospicorp.tides.tide.model.enums.TideKind;
import com.ospicorp.tides.tide.model.enums.WeekNumbering;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;

public final class ResidualAnalyzer {
  public static final int DEFAULT_TOP_N = 5;

  private static final Comparator<ResidualRecord> BY_MAGNITUDE =
      Comparator.comparingDouble((ResidualRecord r) -> Math.abs(r.residual())).reversed()
          .thenComparing(ResidualRecord::timestamp);

  private ResidualAnalyzer() {
  }

  /**
   * Inner join of observed and predicted heights on exact timestamp equality. Timestamps present
   * on one side only, and rows with a missing height on either side, are left out.
   */
  public static List<ResidualRecord> join(Series observed, Series predicted) {
    InconsistentUnitsException.check(observed.unit(), predicted.unit());
    Map<Instant, Sample> predictedByTime = new HashMap<>(predicted.size() * 2);
    for (Sample p : predicted.samples()) {
      if (p.hasHeight()) {
        predictedByTime.put(p.timestamp(), p);
      }
    }
    List<ResidualRecord> out = new ArrayList<>();
    for (Sample o : observed.samples()) {
      Sample p = predictedByTime.get(o.timestamp());
      if (p == null || !o.hasHeight()) {
        continue;
      }
      TideKind kind = o.kind() != null ? o.kind() : p.kind();
      out.add(ResidualRecord.of(o.timestamp(), o.height(), p.height(), kind));
    }
    return out;
  }

  public static ResidualSummary summarize(List<ResidualRecord> records) {
    return summarize(records, DEFAULT_TOP_N);
  }

  public static ResidualSummary summarize(List<ResidualRecord> records, int topN) {
    if (records.isEmpty()) {
      throw new EmptySeriesException("No residuals to summarize");
    }
    double[] residuals = new double[records.size()];
    for (int i = 0; i < residuals.length; i++) {
      residuals[i] = records.get(i).residual();
    }
    return new ResidualSummary(
        residuals.length,
        StatUtils.mean(residuals),
        new Median().evaluate(residuals),
        StatUtils.max(residuals),
        StatUtils.min(residuals),
        largest(records, topN));
  }

  /** The {@code topN} records with the largest absolute residual; ties keep timestamp order. */
  public static List<ResidualRecord> largest(List<ResidualRecord> records, int topN) {
    if (topN < 0) {
      throw new IllegalArgumentException("topN must not be negative");
    }
    return records.stream()
        .sorted(BY_MAGNITUDE)
        .limit(topN)
        .toList();
  }

  /**
   * One summary per week in which {@code observed} has rows, in week order. High/low counts come
   * from the observed rows' kind tags; a week without any joined residual reports no data instead
   * of statistics.
   */
  public static List<WeeklyResidualSummary> summarizeByWeek(Series observed,
      List<ResidualRecord> records, int topN, WeekNumbering numbering) {
    Map<WeekKey, int[]> kindCounts = new TreeMap<>();
    for (Sample s : observed.samples()) {
      int[] counts = kindCounts.computeIfAbsent(weekOf(s.timestamp(), numbering), k -> new int[2]);
      if (s.kind() == TideKind.HIGH) {
        counts[0]++;
      } else if (s.kind() == TideKind.LOW) {
        counts[1]++;
      }
    }
    Map<WeekKey, List<ResidualRecord>> byWeek = new HashMap<>();
    for (ResidualRecord r : records) {
      WeekKey key = weekOf(r.timestamp(), numbering);
      kindCounts.computeIfAbsent(key, k -> new int[2]);
      byWeek.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
    }

    List<WeeklyResidualSummary> out = new ArrayList<>(kindCounts.size());
    for (var e : kindCounts.entrySet()) {
      List<ResidualRecord> weekRecords = byWeek.getOrDefault(e.getKey(), List.of());
      ResidualSummary stats = weekRecords.isEmpty() ? null : summarize(weekRecords, topN);
      out.add(new WeeklyResidualSummary(e.getKey(), e.getValue()[0], e.getValue()[1], stats));
    }
    return out;
  }

  public static WeekKey weekOf(Instant t, WeekNumbering numbering) {
    ZonedDateTime utc = t.atZone(ZoneOffset.UTC);
    return switch (numbering) {
      case ISO -> new WeekKey(utc.get(IsoFields.WEEK_BASED_YEAR),
          utc.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
      case DAY_OF_YEAR -> new WeekKey(utc.getYear(), (utc.getDayOfYear() - 1) / 7 + 1);
    };
  }
}
