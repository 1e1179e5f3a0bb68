package com.ospicorp.tides.tide.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.tides.tide.model.Series;
import com.ospicorp.tides.tide.model.enums.HeightUnit;
import com.ospicorp.tides.tide.model.enums.Resolution;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ResamplerTest {

  @Test
  void resampleEmptyReturnsInput() {
    var input = Series.empty(HeightUnit.FEET);
    assertSame(input, Resampler.resample(input, Resolution.HOUR));
  }

  @Test
  void resampleMinuteToHourKeepsOnTheHourValues() {
    Instant start = Instant.parse("2021-03-01T00:00:00Z");
    var minutes = TideFixtures.series(start, Duration.ofMinutes(1), 181,
        t -> Duration.between(start, t).toMinutes());

    var out = Resampler.resample(minutes, Resolution.HOUR);

    assertEquals(4, out.size());
    assertEquals(start, out.start());
    assertEquals(0d, out.samples().get(0).height());
    assertEquals(60d, out.samples().get(1).height());
    assertEquals(180d, out.samples().get(3).height());
  }

  @Test
  void resampleLeavesGapsAsMissing() {
    var sparse = TideFixtures.sample(HeightUnit.METERS,
        "2021-03-01T00:00:00Z", 1.0,
        "2021-03-01T01:30:00Z", 2.0,
        "2021-03-01T03:00:00Z", 3.0);

    var out = Resampler.resample(sparse, Resolution.HOUR);

    assertEquals(4, out.size());
    assertEquals(1.0, out.samples().get(0).height());
    assertNull(out.samples().get(1).height());
    assertNull(out.samples().get(2).height());
    assertEquals(3.0, out.samples().get(3).height());
    assertEquals(HeightUnit.METERS, out.unit());
  }
}
