package com.ospicorp.tides.tide.model.enums;

public enum WeekNumbering {
  // ISO-8601 week of the week-based year
  ISO,
  // (day-of-year - 1) / 7 + 1, weeks always start on 1 January
  DAY_OF_YEAR
}
