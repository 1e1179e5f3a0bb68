package com.ospicorp.tides.tide.controller;

import com.ospicorp.tides.tide.model.FitRequest;
import com.ospicorp.tides.tide.model.HarmonicModel;
import com.ospicorp.tides.tide.model.PredictRequest;
import com.ospicorp.tides.tide.model.Prediction;
import com.ospicorp.tides.tide.model.PredictionResponse;
import com.ospicorp.tides.tide.model.Sample;
import com.ospicorp.tides.tide.model.SamplePayload;
import com.ospicorp.tides.tide.model.Series;
import com.ospicorp.tides.tide.model.SeriesPayload;
import com.ospicorp.tides.tide.model.ValidateRequest;
import com.ospicorp.tides.tide.model.ValidationReport;
import com.ospicorp.tides.tide.model.enums.AlignmentMode;
import com.ospicorp.tides.tide.model.enums.HeightUnit;
import com.ospicorp.tides.tide.model.enums.Resolution;
import com.ospicorp.tides.tide.model.enums.TideKind;
import com.ospicorp.tides.tide.service.FitOptions;
import com.ospicorp.tides.tide.service.ResidualReportFormatter;
import com.ospicorp.tides.tide.service.TideValidationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/tides")
@Validated
@Tag(name = "Tides")
public class TideController {
  private static final MediaType CSV_MEDIA_TYPE = MediaType.valueOf("text/csv");
  private static final String ERROR_DOCS_BASE = "https://docs.tides.ospicorp.dev/errors/";

  private final TideValidationService svc;

  public TideController(TideValidationService svc) {
    this.svc = svc;
  }

  @PostMapping("/fit")
  @Operation(summary = "Fit a harmonic model",
      description = "Least-squares fit of the constituent catalogue to a gauge series.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Fitted model",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = HarmonicModel.class))),
      @ApiResponse(responseCode = "422", description = "Series cannot support the fit",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public HarmonicModel fit(@RequestBody @Valid FitRequest request) {
    FitOptions options = FitOptions.defaults()
        .withSubtractMeanSeaLevel(request.subtractMeanSeaLevel())
        .withNodalCorrections(request.nodalCorrections());
    if (request.epoch() != null) {
      options = options.withEpoch(request.epoch());
    }
    return svc.fit(toSeries(request.series()), request.constituents(), options);
  }

  @PostMapping("/predict")
  @Operation(summary = "Predict tide heights",
      description = "Evaluate a model on a regular grid and detect high and low water.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Predicted series",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = PredictionResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> predict(@RequestBody @Valid PredictRequest request,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    Resolution resolution = parseResolution(request.resolution());
    if (!request.start().isBefore(request.end())) {
      throw invalidParameter("start", "start must be before end.", 2005);
    }
    Prediction prediction = svc.predict(request.model(), request.start(), request.end(),
        request.step(), resolution);

    MediaType contentType = selectMediaType(format, accept, CSV_MEDIA_TYPE, "csv");
    if (contentType.isCompatibleWith(CSV_MEDIA_TYPE)) {
      return ResponseEntity.ok().contentType(CSV_MEDIA_TYPE).body(prediction.series().samples());
    }
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON)
        .body(prediction.toResponse());
  }

  @PostMapping("/validate")
  @Operation(summary = "Validate reference observations",
      description = "Fit the gauge series, predict, align the reference series and summarize "
          + "the residuals in full and per week.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Validation report",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = ValidationReport.class)),
              @Content(mediaType = "text/plain")
          }),
      @ApiResponse(responseCode = "422", description = "Analysis failed",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> validate(@RequestBody @Valid ValidateRequest request,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    AlignmentMode mode = parseMode(request.mode());
    if (request.topN() != null && request.topN() < 0) {
      throw invalidParameter("top_n", "top_n must not be negative.", 2006);
    }
    if (request.maxDistance() != null && request.maxDistance().isNegative()) {
      throw invalidParameter("max_distance", "max_distance must not be negative.", 2007);
    }
    ValidationReport report = svc.validate(toSeries(request.gauge()),
        toSeries(request.reference()), mode, request.maxDistance(), request.topN(),
        request.constituents(), request.start(), request.end());

    MediaType contentType = selectMediaType(format, accept, MediaType.TEXT_PLAIN, "text");
    if (contentType.isCompatibleWith(MediaType.TEXT_PLAIN)) {
      return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN)
          .body(ResidualReportFormatter.format(report));
    }
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(report);
  }

  static Series toSeries(SeriesPayload payload) {
    HeightUnit unit = parseUnit(payload.unit());
    List<Sample> samples = new ArrayList<>(payload.samples().size());
    for (SamplePayload p : payload.samples()) {
      samples.add(new Sample(p.timestamp(), p.height(), TideKind.fromLabel(p.kind())));
    }
    return new Series(unit, samples);
  }

  private static HeightUnit parseUnit(String value) {
    try {
      return switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "m", "meter", "meters", "metres" -> HeightUnit.METERS;
        case "ft", "foot", "feet" -> HeightUnit.FEET;
        default -> HeightUnit.valueOf(value.toUpperCase(Locale.ROOT));
      };
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("unit", "Invalid unit. Supported values: meters,feet.", 2001);
    }
  }

  private static AlignmentMode parseMode(String value) {
    if (!StringUtils.hasText(value)) {
      return AlignmentMode.INTERPOLATE;
    }
    try {
      return AlignmentMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("mode",
          "Invalid mode. Supported values: interpolate,nearest_extrema.", 2002);
    }
  }

  private static Resolution parseResolution(String value) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    try {
      return Resolution.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("resolution",
          "Invalid resolution. Supported values: minute,hour.", 2004);
    }
  }

  private static MediaType selectMediaType(String format, String accept, MediaType alternative,
      String alternativeName) {
    if (StringUtils.hasText(format)) {
      if (alternativeName.equalsIgnoreCase(format)) {
        return alternative;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw invalidParameter("format",
          "Invalid format value. Supported values: json," + alternativeName + ".", 2003);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(alternative)) {
        return alternative;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  private static InvalidParameterException invalidParameter(String parameter, String message,
      int errorCode) {
    return new InvalidParameterException(parameter, message, errorCode,
        ERROR_DOCS_BASE + errorCode);
  }
}
