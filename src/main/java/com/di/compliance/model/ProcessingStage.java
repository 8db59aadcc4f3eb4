package com.di.compliance.model;

/**
 * Pipeline stages in their strict execution order.
 */
public enum ProcessingStage {
    RECEIVE,
    PARSE,
    NORMALIZE,
    VALIDATE,
    PERSIST
}
