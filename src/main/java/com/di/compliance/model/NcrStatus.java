package com.di.compliance.model;

public enum NcrStatus {
    OPEN,
    IN_REVIEW,
    CLOSED,
    CANCELLED
}
