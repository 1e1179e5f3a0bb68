package com.ospicorp.tides.tide.controller;

/**
 * A request field with a value the tide endpoints do not accept (unknown unit, mode, format...).
 * Carries a stable numeric code and the name of the offending field for the problem response.
 */
public class InvalidParameterException extends RuntimeException {
  private final String parameter;
  private final int errorCode;
  private final String moreInfo;

  public InvalidParameterException(String parameter, String message, int errorCode,
      String moreInfo) {
    super(message);
    this.parameter = parameter;
    this.errorCode = errorCode;
    this.moreInfo = moreInfo;
  }

  public String parameter() {
    return parameter;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return moreInfo;
  }
}
