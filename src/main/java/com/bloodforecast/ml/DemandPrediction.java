package com.bloodforecast.ml;

public record DemandPrediction(double units, double confidence) {}
