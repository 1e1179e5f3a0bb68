package com.ospicorp.tides.tide.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.tides.tide.model.ResidualRecord;
import com.ospicorp.tides.tide.model.ResidualSummary;
import com.ospicorp.tides.tide.model.Sample;
import com.ospicorp.tides.tide.model.Series;
import com.ospicorp.tides.tide.model.WeekKey;
import com.ospicorp.tides.tide.model.WeeklyResidualSummary;
import com.ospicorp.tides.tide.model.enums.HeightUnit;
import com.ospicorp.tides.tide.model.enums.TideKind;
import com.ospicorp.tides.tide.model.enums.WeekNumbering;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResidualAnalyzerTest {
  private static final Instant MONDAY = Instant.parse("2021-04-05T00:00:00Z");

  @Test
  void joinKeepsOnlyCommonTimestampsWithHeights() {
    Series observed = new Series(HeightUnit.METERS, List.of(
        new Sample(MONDAY, 1.5, TideKind.HIGH),
        new Sample(MONDAY.plusSeconds(3600), null, TideKind.LOW),
        new Sample(MONDAY.plusSeconds(7200), 0.4),
        new Sample(MONDAY.plusSeconds(9000), 0.2)));
    Series predicted = TideFixtures.sample(HeightUnit.METERS,
        "2021-04-05T00:00:00Z", 1.25,
        "2021-04-05T01:00:00Z", 0.8,
        "2021-04-05T02:00:00Z", 0.5);

    List<ResidualRecord> records = ResidualAnalyzer.join(observed, predicted);

    assertEquals(2, records.size());
    assertEquals(0.25, records.get(0).residual(), 1e-12);
    assertEquals(TideKind.HIGH, records.get(0).kind());
    assertEquals(-0.1, records.get(1).residual(), 1e-12);
    assertNull(records.get(1).kind());
  }

  @Test
  void swappingSidesNegatesResiduals() {
    Series a = TideFixtures.sample(HeightUnit.FEET, "2021-04-05T00:00:00Z", 3.0,
        "2021-04-05T01:00:00Z", -1.0);
    Series b = TideFixtures.sample(HeightUnit.FEET, "2021-04-05T00:00:00Z", 2.5,
        "2021-04-05T01:00:00Z", 0.5);

    List<ResidualRecord> ab = ResidualAnalyzer.join(a, b);
    List<ResidualRecord> ba = ResidualAnalyzer.join(b, a);

    for (int i = 0; i < ab.size(); i++) {
      assertEquals(-ab.get(i).residual(), ba.get(i).residual(), 1e-12);
    }
  }

  @Test
  void joinRejectsMixedUnits() {
    Series meters = TideFixtures.sample(HeightUnit.METERS, "2021-04-05T00:00:00Z", 1.0);
    Series feet = TideFixtures.sample(HeightUnit.FEET, "2021-04-05T00:00:00Z", 1.0);

    assertThrows(InconsistentUnitsException.class, () -> ResidualAnalyzer.join(meters, feet));
  }

  @Test
  void summaryStatistics() {
    List<ResidualRecord> records = records(1, 2, 3, 4);

    ResidualSummary summary = ResidualAnalyzer.summarize(records);

    assertEquals(4, summary.count());
    assertEquals(2.5, summary.mean(), 1e-12);
    assertEquals(2.5, summary.median(), 1e-12);
    assertEquals(4.0, summary.max());
    assertEquals(1.0, summary.min());
    assertEquals(4, summary.largest().size());
    assertEquals(4.0, summary.largest().get(0).residual());
  }

  @Test
  void outlierLeadsTheLargestList() {
    double[] residuals = new double[100];
    for (int i = 0; i < residuals.length; i++) {
      residuals[i] = 0.1 * ((i % 2 == 0) ? 1 : -1);
    }
    residuals[37] = 5.0;
    residuals[80] = -0.45;

    ResidualSummary summary = ResidualAnalyzer.summarize(records(residuals), 5);

    assertEquals(100, summary.count());
    assertEquals(5, summary.largest().size());
    assertEquals(5.0, summary.largest().get(0).residual());
    assertEquals(-0.45, summary.largest().get(1).residual());
    assertEquals(5.0, summary.max());
    assertEquals(-0.45, summary.min());
  }

  @Test
  void equalMagnitudesRankByTime() {
    List<ResidualRecord> ranked = ResidualAnalyzer.largest(records(0.5, -0.5, 0.1), 2);

    assertEquals(MONDAY, ranked.get(0).timestamp());
    assertEquals(MONDAY.plusSeconds(3600), ranked.get(1).timestamp());
  }

  @Test
  void topNLargerThanInputReturnsEverything() {
    assertEquals(2, ResidualAnalyzer.largest(records(1, 2), 10).size());
    assertTrue(ResidualAnalyzer.largest(records(1, 2), 0).isEmpty());
    assertThrows(IllegalArgumentException.class,
        () -> ResidualAnalyzer.largest(records(1), -1));
  }

  @Test
  void emptyInputCannotBeSummarized() {
    assertThrows(EmptySeriesException.class, () -> ResidualAnalyzer.summarize(List.of()));
  }

  @Test
  void weeklySummariesReportWeeksWithoutResiduals() {
    Instant nextMonday = Instant.parse("2021-04-12T06:00:00Z");
    Series observed = new Series(HeightUnit.METERS, List.of(
        new Sample(MONDAY.plusSeconds(3600), 1.2, TideKind.HIGH),
        new Sample(MONDAY.plusSeconds(8 * 3600), -0.3, TideKind.LOW),
        new Sample(MONDAY.plusSeconds(14 * 3600), 1.1, TideKind.HIGH),
        new Sample(nextMonday, 1.0, TideKind.HIGH)));
    List<ResidualRecord> residuals = List.of(
        ResidualRecord.of(MONDAY.plusSeconds(3600), 1.2, 1.0, TideKind.HIGH),
        ResidualRecord.of(MONDAY.plusSeconds(8 * 3600), -0.3, -0.2, TideKind.LOW));

    List<WeeklyResidualSummary> weekly =
        ResidualAnalyzer.summarizeByWeek(observed, residuals, 5, WeekNumbering.ISO);

    assertEquals(2, weekly.size());
    WeeklyResidualSummary first = weekly.get(0);
    assertEquals(new WeekKey(2021, 14), first.week());
    assertEquals(2, first.highCount());
    assertEquals(1, first.lowCount());
    assertTrue(first.hasData());
    assertEquals(2, first.stats().count());
    assertEquals(0.2, first.stats().largest().get(0).residual(), 1e-12);

    WeeklyResidualSummary second = weekly.get(1);
    assertEquals(new WeekKey(2021, 15), second.week());
    assertEquals(1, second.highCount());
    assertFalse(second.hasData());
    assertTrue(second.summary().isEmpty());
  }

  @Test
  void weekNumberingSchemes() {
    Instant newYear = Instant.parse("2021-01-01T12:00:00Z");

    assertEquals(new WeekKey(2020, 53), ResidualAnalyzer.weekOf(newYear, WeekNumbering.ISO));
    assertEquals(new WeekKey(2021, 1),
        ResidualAnalyzer.weekOf(newYear, WeekNumbering.DAY_OF_YEAR));
    assertEquals(new WeekKey(2021, 2),
        ResidualAnalyzer.weekOf(Instant.parse("2021-01-08T00:00:00Z"), WeekNumbering.DAY_OF_YEAR));
  }

  private static List<ResidualRecord> records(double... residuals) {
    List<ResidualRecord> out = new ArrayList<>(residuals.length);
    for (int i = 0; i < residuals.length; i++) {
      Instant t = MONDAY.plus(Duration.ofHours(i));
      out.add(ResidualRecord.of(t, residuals[i], 0d, null));
    }
    return out;
  }
}
