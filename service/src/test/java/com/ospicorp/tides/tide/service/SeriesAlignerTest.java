package com.ospicorp.tides.tide.service;

import static com.ospicorp.tides.tide.service.TideFixtures.JUNE_2021;
import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.tides.tide.model.NearestMatch;
import com.ospicorp.tides.tide.model.Sample;
import com.ospicorp.tides.tide.model.Series;
import com.ospicorp.tides.tide.model.enums.HeightUnit;
import com.ospicorp.tides.tide.model.enums.TideKind;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.ToDoubleFunction;
import org.junit.jupiter.api.Test;

class SeriesAlignerTest {

  private static final ToDoubleFunction<Instant> SINE =
      t -> Math.sin(2 * Math.PI * TimeGrid.hoursSince(JUNE_2021, t) / 12.42);

  @Test
  void interpolatingOntoTheDenseGridIsIdentity() {
    Series dense = TideFixtures.series(JUNE_2021, Duration.ofMinutes(10), 100, SINE);

    Series aligned = SeriesAligner.interpolate(dense, dense);

    assertEquals(dense.size(), aligned.size());
    for (int i = 0; i < dense.size(); i++) {
      assertEquals(dense.samples().get(i).height(), aligned.samples().get(i).height());
    }
  }

  @Test
  void offGridValuesFollowTheCurve() {
    Series dense = TideFixtures.series(JUNE_2021, Duration.ofMinutes(1), 24 * 60 + 1, SINE);
    Series sparse = TideFixtures.series(JUNE_2021.plusSeconds(17), Duration.ofSeconds(977), 80,
        t -> 0d);

    Series aligned = SeriesAligner.interpolate(sparse, dense);

    for (Sample s : aligned.samples()) {
      assertEquals(SINE.applyAsDouble(s.timestamp()), s.height(), 1e-5, s.timestamp().toString());
    }
  }

  @Test
  void sparseKindsAreKept() {
    Series dense = TideFixtures.series(JUNE_2021, Duration.ofMinutes(10), 12, SINE);
    Series sparse = new Series(HeightUnit.METERS, List.of(
        new Sample(JUNE_2021.plusSeconds(900), 0.2, TideKind.HIGH),
        new Sample(JUNE_2021.plusSeconds(1500), 0.1, TideKind.LOW)));

    Series aligned = SeriesAligner.interpolate(sparse, dense);

    assertEquals(TideKind.HIGH, aligned.samples().get(0).kind());
    assertEquals(TideKind.LOW, aligned.samples().get(1).kind());
  }

  @Test
  void timestampsOutsideTheDenseSeriesAreRejected() {
    Series dense = TideFixtures.series(JUNE_2021, Duration.ofMinutes(10), 12, SINE);
    Instant late = JUNE_2021.plus(Duration.ofHours(3));
    Series sparse = new Series(HeightUnit.METERS, List.of(new Sample(late, 1.0)));

    InterpolationRangeException e = assertThrows(InterpolationRangeException.class,
        () -> SeriesAligner.interpolate(sparse, dense));
    assertEquals(late, e.requested());
  }

  @Test
  void unitsMustMatch() {
    Series dense = TideFixtures.series(JUNE_2021, Duration.ofMinutes(10), 12, SINE);
    Series feet = new Series(HeightUnit.FEET, List.of(new Sample(JUNE_2021, 1.0)));

    assertThrows(InconsistentUnitsException.class, () -> SeriesAligner.interpolate(feet, dense));
    assertThrows(InconsistentUnitsException.class, () -> SeriesAligner.matchNearest(dense, feet));
  }

  @Test
  void emptySparseSeriesGivesEmptyResult() {
    Series dense = TideFixtures.series(JUNE_2021, Duration.ofMinutes(10), 12, SINE);

    assertTrue(SeriesAligner.interpolate(Series.empty(HeightUnit.METERS), dense).isEmpty());
  }

  @Test
  void nearestMatchPicksClosestAndEarlierOnTies() {
    Series refs = TideFixtures.sample(HeightUnit.METERS,
        "2021-06-01T00:00:00Z", 1.0,
        "2021-06-01T06:00:00Z", -1.0,
        "2021-06-01T12:00:00Z", 1.1);
    Series obs = TideFixtures.sample(HeightUnit.METERS,
        "2021-05-31T23:50:00Z", 0.9,
        "2021-06-01T03:00:00Z", 0.0,
        "2021-06-01T06:20:00Z", -0.8,
        "2021-06-01T13:00:00Z", 1.2);

    List<NearestMatch> matches = SeriesAligner.matchNearest(refs, obs);

    assertEquals(4, matches.size());
    assertEquals(1.0, matches.get(0).reference().height());
    assertEquals(Duration.ofMinutes(-10), matches.get(0).offset());
    assertEquals(Instant.parse("2021-06-01T00:00:00Z"), matches.get(1).reference().timestamp());
    assertEquals(Duration.ofHours(3), matches.get(1).offset());
    assertEquals(-1.0, matches.get(2).reference().height());
    assertEquals(Duration.ofMinutes(20), matches.get(2).offset());
    assertEquals(1.1, matches.get(3).reference().height());
    assertTrue(matches.stream().allMatch(NearestMatch::matched));
  }

  @Test
  void observationsBeyondTheCutoffStayUnmatched() {
    Series refs = TideFixtures.sample(HeightUnit.METERS,
        "2021-06-01T00:00:00Z", 1.0,
        "2021-06-01T06:00:00Z", -1.0);
    Series obs = TideFixtures.sample(HeightUnit.METERS,
        "2021-06-01T00:30:00Z", 0.9,
        "2021-06-01T03:00:00Z", 0.0);

    List<NearestMatch> matches = SeriesAligner.matchNearest(refs, obs, Duration.ofHours(1));

    assertTrue(matches.get(0).matched());
    assertFalse(matches.get(1).matched());
    assertNull(matches.get(1).reference());
    assertEquals(Duration.ofHours(3), matches.get(1).offset());
  }

  @Test
  void alignNearestCarriesReferenceHeightsAtObservationTimes() {
    Series refs = TideFixtures.sample(HeightUnit.METERS,
        "2021-06-01T00:00:00Z", 1.0,
        "2021-06-01T06:00:00Z", -1.0);
    Series obs = new Series(HeightUnit.METERS, List.of(
        new Sample(Instant.parse("2021-06-01T00:07:00Z"), 1.05, TideKind.HIGH),
        new Sample(Instant.parse("2021-06-01T05:55:00Z"), -0.95, TideKind.LOW),
        new Sample(Instant.parse("2021-06-01T09:00:00Z"), 0.1)));

    Series aligned = SeriesAligner.alignNearest(refs, obs, Duration.ofHours(2));

    assertEquals(3, aligned.size());
    assertEquals(obs.timestamps(), aligned.timestamps());
    assertEquals(1.0, aligned.samples().get(0).height());
    assertEquals(TideKind.HIGH, aligned.samples().get(0).kind());
    assertEquals(-1.0, aligned.samples().get(1).height());
    assertNull(aligned.samples().get(2).height());
  }

  @Test
  void emptyReferencesCannotBeMatched() {
    Series obs = TideFixtures.sample(HeightUnit.METERS, "2021-06-01T00:00:00Z", 1.0);

    assertThrows(EmptySeriesException.class,
        () -> SeriesAligner.matchNearest(Series.empty(HeightUnit.METERS), obs));
    assertTrue(SeriesAligner.matchNearest(obs, Series.empty(HeightUnit.METERS)).isEmpty());
  }

  @Test
  void negativeCutoffIsRejected() {
    Series refs = TideFixtures.sample(HeightUnit.METERS, "2021-06-01T00:00:00Z", 1.0);
    Series obs = TideFixtures.sample(HeightUnit.METERS, "2021-06-01T00:00:00Z", 1.0);

    assertThrows(IllegalArgumentException.class,
        () -> SeriesAligner.matchNearest(refs, obs, Duration.ofMinutes(-5)));
    assertTrue(SeriesAligner.matchNearest(refs, obs, Duration.ZERO).get(0).matched());
  }
}
