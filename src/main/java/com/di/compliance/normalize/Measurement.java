package com.di.compliance.normalize;

import java.math.BigDecimal;

/**
 * Numeric value in its canonical unit ({@code mm}, {@code N}, {@code %}), or in the original
 * unit when that unit is not recognised.
 */
public record Measurement(BigDecimal value, String unit) {
}
