package com.ospicorp.tides.tide.model.enums;

public enum AlignmentMode {
  // spline over the dense prediction, evaluated at the reference timestamps
  INTERPOLATE,
  // each reference observation paired with the closest predicted high/low
  NEAREST_EXTREMA
}
