package com.di.compliance.model;

public enum NcrSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
