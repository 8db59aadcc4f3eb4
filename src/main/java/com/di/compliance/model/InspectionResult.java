package com.di.compliance.model;

public enum InspectionResult {
    PASS,
    FAIL,
    CONDITIONAL
}
