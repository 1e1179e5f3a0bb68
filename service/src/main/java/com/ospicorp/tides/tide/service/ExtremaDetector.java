package com.ospicorp.tides.tide.service;

import com.ospicorp.tides.tide.model.ExtremaEvent;
import com.ospicorp.tides.tide.model.Sample;
import com.ospicorp.tides.tide.model.Series;
import com.ospicorp.tides.tide.model.enums.HeightUnit;
import com.ospicorp.tides.tide.model.enums.TideKind;
import java.util.ArrayList;
import java.util.List;

/**
 * High/low water detection on a dense predicted curve.
 *
 * <p>An interior sample is a high when it is {@code >=} both neighbours and strictly greater than
 * at least one of them; lows are symmetric. The first and last samples are never reported. Runs of
 * same-kind candidates (plateaus, noise) collapse to the most extreme member, so the returned kinds
 * always alternate.
 */
public final class ExtremaDetector {

  private ExtremaDetector() {
  }

  public static List<ExtremaEvent> detect(Series predicted) {
    if (predicted.isEmpty()) {
      throw new EmptySeriesException("Cannot detect extrema on an empty series");
    }
    List<Sample> points = predicted.withHeights();
    List<ExtremaEvent> out = new ArrayList<>();
    if (points.size() < 3) {
      return out;
    }

    for (int i = 1; i < points.size() - 1; i++) {
      double before = points.get(i - 1).height();
      double here = points.get(i).height();
      double after = points.get(i + 1).height();

      TideKind kind = null;
      if (here >= before && here >= after && (here > before || here > after)) {
        kind = TideKind.HIGH;
      } else if (here <= before && here <= after && (here < before || here < after)) {
        kind = TideKind.LOW;
      }
      if (kind == null) {
        continue;
      }

      ExtremaEvent candidate = new ExtremaEvent(points.get(i).timestamp(), here, kind);
      if (out.isEmpty() || out.get(out.size() - 1).kind() != kind) {
        out.add(candidate);
      } else if (moreExtreme(candidate, out.get(out.size() - 1))) {
        out.set(out.size() - 1, candidate);
      }
    }
    return out;
  }

  /** The events as a series of tagged samples, for nearest-time alignment. */
  public static Series asSeries(HeightUnit unit, List<ExtremaEvent> events) {
    List<Sample> samples = new ArrayList<>(events.size());
    for (ExtremaEvent e : events) {
      samples.add(e.toSample());
    }
    return new Series(unit, samples);
  }

  private static boolean moreExtreme(ExtremaEvent candidate, ExtremaEvent current) {
    return candidate.kind() == TideKind.HIGH
        ? candidate.height() > current.height()
        : candidate.height() < current.height();
  }
}
