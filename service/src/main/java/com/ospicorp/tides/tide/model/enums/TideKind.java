package com.ospicorp.tides.tide.model.enums;

import java.util.Locale;

public enum TideKind {
  HIGH,
  LOW;

  /**
   * Parses the labels used by digitized high/low tables ("h", "l", "high", "low"), case
   * insensitive. Returns {@code null} for a blank label.
   */
  public static TideKind fromLabel(String label) {
    if (label == null || label.isBlank()) {
      return null;
    }
    String normalized = label.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "h", "high" -> HIGH;
      case "l", "low" -> LOW;
      default -> throw new IllegalArgumentException("Unknown tide kind label: " + label);
    };
  }
}
