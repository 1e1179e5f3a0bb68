package com.ospicorp.tides.tide.service;

import com.ospicorp.tides.tide.model.ConstituentCatalogue;
import com.ospicorp.tides.tide.model.ExtremaEvent;
import com.ospicorp.tides.tide.model.HarmonicModel;
import com.ospicorp.tides.tide.model.Prediction;
import com.ospicorp.tides.tide.model.ResidualRecord;
import com.ospicorp.tides.tide.model.ResidualSummary;
import com.ospicorp.tides.tide.model.Series;
import com.ospicorp.tides.tide.model.ValidationReport;
import com.ospicorp.tides.tide.model.WeeklyResidualSummary;
import com.ospicorp.tides.tide.model.enums.AlignmentMode;
import com.ospicorp.tides.tide.model.enums.Resolution;
import com.ospicorp.tides.tide.model.enums.WeekNumbering;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs the validation pipeline: fit the gauge record, predict a dense curve, detect high and low
 * water, align the reference observations and summarize the residuals.
 */
@Service
public class TideValidationService {
  private static final Logger log = LoggerFactory.getLogger(TideValidationService.class);

  private final ConstituentCatalogue catalogue;
  private final int defaultTopN;
  private final WeekNumbering weekNumbering;
  private final Duration predictionStep;
  private final boolean rayleighSelection;
  private final long maxPredictionPoints;

  public TideValidationService(ConstituentCatalogue catalogue,
      @Value("${tides.analysis.top-n:5}") int defaultTopN,
      @Value("${tides.analysis.week-numbering:day_of_year}") String weekNumbering,
      @Value("${tides.prediction.step:PT1M}") Duration predictionStep,
      @Value("${tides.fit.rayleigh-selection:true}") boolean rayleighSelection,
      @Value("${tides.prediction.max-points:2000000}") long maxPredictionPoints) {
    if (defaultTopN < 0) {
      throw new IllegalArgumentException("tides.analysis.top-n must not be negative");
    }
    if (maxPredictionPoints < 2) {
      throw new IllegalArgumentException("tides.prediction.max-points must be at least 2");
    }
    this.catalogue = catalogue;
    this.defaultTopN = defaultTopN;
    this.weekNumbering = WeekNumbering.valueOf(
        weekNumbering.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    this.predictionStep = predictionStep;
    this.rayleighSelection = rayleighSelection;
    this.maxPredictionPoints = maxPredictionPoints;
  }

  public HarmonicModel fit(Series gauge, List<String> constituents, FitOptions options) {
    ConstituentCatalogue selected = selectConstituents(gauge, constituents);
    log.info("Fitting {} constituents to {} gauge samples ({} to {})",
        selected.size(), gauge.size(), gauge.start(), gauge.end());
    return HarmonicFitter.fit(gauge, selected, options);
  }

  public Prediction predict(HarmonicModel model, Instant start, Instant end, Duration step,
      Resolution resolution) {
    Duration effectiveStep = step != null ? step : predictionStep;
    checkGridSize(start, end, effectiveStep);
    Series dense = TidePredictor.predict(model, start, end, effectiveStep);
    List<ExtremaEvent> extrema = ExtremaDetector.detect(dense);
    log.debug("Predicted {} points with {} extrema between {} and {}",
        dense.size(), extrema.size(), start, end);
    Series out = resolution != null ? Resampler.resample(dense, resolution) : dense;
    return new Prediction(out, extrema);
  }

  /**
   * Full validation of {@code reference} against a model fitted on {@code gauge}. The prediction
   * window defaults to the whole hours covering both series.
   */
  public ValidationReport validate(Series gauge, Series reference, AlignmentMode mode,
      Duration maxDistance, Integer topN, List<String> constituents, Instant start, Instant end) {
    InconsistentUnitsException.check(gauge.unit(), reference.unit());
    if (reference.isEmpty()) {
      throw new EmptySeriesException("Reference series has no observations to validate");
    }
    int n = topN != null ? topN : defaultTopN;

    Instant from = start != null ? start : earliest(gauge, reference);
    Instant to = end != null ? end : TimeGrid.ceil(latest(gauge, reference), Resolution.HOUR);
    checkGridSize(from, to, predictionStep);

    HarmonicModel model = fit(gauge, constituents, FitOptions.defaults());
    Series dense = TidePredictor.predict(model, from, to, predictionStep);
    List<ExtremaEvent> extrema = ExtremaDetector.detect(dense);

    Series aligned = switch (mode) {
      case INTERPOLATE -> SeriesAligner.interpolate(reference, dense);
      case NEAREST_EXTREMA -> SeriesAligner.alignNearest(
          ExtremaDetector.asSeries(dense.unit(), extrema), reference, maxDistance);
    };

    List<ResidualRecord> residuals = ResidualAnalyzer.join(reference, aligned);
    ResidualSummary summary = null;
    if (residuals.isEmpty()) {
      log.warn("No reference observation could be paired with the prediction ({} rows, mode {})",
          reference.size(), mode);
    } else {
      summary = ResidualAnalyzer.summarize(residuals, n);
    }
    List<WeeklyResidualSummary> weekly =
        ResidualAnalyzer.summarizeByWeek(reference, residuals, n, weekNumbering);

    log.info("Validated {} reference rows: {} residuals over {} weeks", reference.size(),
        residuals.size(), weekly.size());
    return new ValidationReport(model, mode, dense.unit(), dense.size(), extrema, residuals,
        summary, weekly);
  }

  private ConstituentCatalogue selectConstituents(Series gauge, List<String> names) {
    if (names != null && !names.isEmpty()) {
      return catalogue.select(names);
    }
    if (rayleighSelection) {
      Duration observedSpan = gauge.heightSpan();
      ConstituentCatalogue resolvable = catalogue.resolvableOver(observedSpan);
      log.debug("Rayleigh selection kept {} of {} constituents for {} of observed heights",
          resolvable.size(), catalogue.size(), observedSpan);
      if (resolvable.isEmpty()) {
        throw new InsufficientDataException("Observed heights spanning " + observedSpan
            + " are too short to resolve any constituent");
      }
      return resolvable;
    }
    return catalogue;
  }

  private void checkGridSize(Instant start, Instant end, Duration step) {
    long points = TimeGrid.count(start, end, step);
    if (points > maxPredictionPoints) {
      throw new IllegalArgumentException("Prediction from " + start + " to " + end + " every "
          + step + " needs " + points + " points, more than the limit of " + maxPredictionPoints);
    }
  }

  private static Instant earliest(Series a, Series b) {
    Instant first = a.isEmpty() ? b.start() : a.start();
    if (!b.isEmpty() && b.start().isBefore(first)) {
      first = b.start();
    }
    return first.truncatedTo(Resolution.HOUR.unit());
  }

  private static Instant latest(Series a, Series b) {
    Instant last = a.isEmpty() ? b.end() : a.end();
    if (!b.isEmpty() && b.end().isAfter(last)) {
      last = b.end();
    }
    return last;
  }
}
