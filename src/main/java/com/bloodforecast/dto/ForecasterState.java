package com.bloodforecast.dto;

public enum ForecasterState {
    UNTRAINED,
    TRAINING,
    TRAINED
}
