package com.ospicorp.tides.tide.model;

// amplitude in the model's height unit, phase in degrees [0, 360)
public record ConstituentFit(String name, double speed, double amplitude, double phase) {}
