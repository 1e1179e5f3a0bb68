package com.ospicorp.tides.tide.model.enums;

public enum HeightUnit {
  METERS,
  FEET
}
