package com.ospicorp.tides.tide.service;

import com.ospicorp.tides.tide.model.enums.HeightUnit;

public class InconsistentUnitsException extends TideAnalysisException {

  public InconsistentUnitsException(HeightUnit left, HeightUnit right) {
    super("Cannot compare series in " + left + " with series in " + right);
  }

  static void check(HeightUnit left, HeightUnit right) {
    if (left != right) {
      throw new InconsistentUnitsException(left, right);
    }
  }
}
