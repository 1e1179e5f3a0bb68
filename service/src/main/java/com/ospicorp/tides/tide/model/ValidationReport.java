package com.ospicorp.tides.tide.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.tides.tide.model.enums.AlignmentMode;
import com.ospicorp.tides.tide.model.enums.HeightUnit;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationReport(
    HarmonicModel model,
    AlignmentMode mode,
    HeightUnit unit,
    @JsonProperty("prediction_points") int predictionPoints,
    List<ExtremaEvent> extrema,
    List<ResidualRecord> residuals,
    ResidualSummary summary,
    List<WeeklyResidualSummary> weekly
) {}
