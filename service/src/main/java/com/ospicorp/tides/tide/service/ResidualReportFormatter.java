package com.ospicorp.tides.tide.service;

import com.ospicorp.tides.tide.model.ResidualRecord;
import com.ospicorp.tides.tide.model.ResidualSummary;
import com.ospicorp.tides.tide.model.ValidationReport;
import com.ospicorp.tides.tide.model.WeeklyResidualSummary;
import java.util.List;
import java.util.Locale;

/** Plain-text residual report; values are shown to 3 decimals. */
public final class ResidualReportFormatter {
  private static final String ROW_FORMAT = "%-22s %-5s %10s %10s %10s%n";

  private ResidualReportFormatter() {
  }

  public static String format(ValidationReport report) {
    StringBuilder out = new StringBuilder();
    out.append("Summary of Residuals (").append(report.unit().name().toLowerCase(Locale.ROOT))
        .append(", ").append(report.mode().name().toLowerCase(Locale.ROOT)).append("):\n");
    appendSummary(out, report.summary(), "Top %d Largest Residuals:");

    for (WeeklyResidualSummary week : report.weekly()) {
      out.append('\n')
          .append("Week: ").append(week.week().week())
          .append(" (").append(week.week().year()).append(")\n")
          .append("Number of highs: ").append(week.highCount()).append('\n')
          .append("Number of lows: ").append(week.lowCount()).append('\n');
      appendSummary(out, week.stats(), "%d largest residuals:");
    }
    return out.toString();
  }

  private static void appendSummary(StringBuilder out, ResidualSummary summary, String topTitle) {
    if (summary == null) {
      out.append("No data\n");
      return;
    }
    out.append("Total observations: ").append(summary.count()).append('\n')
        .append("Mean Residual: ").append(round(summary.mean())).append('\n')
        .append("Median Residual: ").append(round(summary.median())).append('\n')
        .append("Max Residual: ").append(round(summary.max())).append('\n')
        .append("Min Residual: ").append(round(summary.min())).append("\n\n")
        .append(String.format(Locale.ROOT, topTitle, summary.largest().size())).append('\n');
    appendRows(out, summary.largest());
  }

  private static void appendRows(StringBuilder out, List<ResidualRecord> rows) {
    out.append(String.format(Locale.ROOT, ROW_FORMAT,
        "DateTime", "Kind", "Observed", "Predicted", "Residual"));
    for (ResidualRecord r : rows) {
      out.append(String.format(Locale.ROOT, ROW_FORMAT,
          r.timestamp(),
          r.kind() == null ? "" : r.kind().name().substring(0, 1).toLowerCase(Locale.ROOT),
          round(r.observed()),
          round(r.predicted()),
          round(r.residual())));
    }
  }

  static String round(double value) {
    return String.format(Locale.ROOT, "%.3f", value);
  }
}
