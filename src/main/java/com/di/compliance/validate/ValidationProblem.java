package com.di.compliance.validate;

/**
 * One missing or invalid field of a row.
 *
 * @param field    field name
 * @param position 1-based row number
 * @param message  human-readable reason, prefixed with the row number
 */
public record ValidationProblem(String field, int position, String message) {

    static ValidationProblem missing(String field, int position) {
        return new ValidationProblem(field, position,
                String.format("Row %d: Missing required field '%s'", position, field));
    }

    static ValidationProblem invalid(String field, int position, String detail) {
        return new ValidationProblem(field, position,
                String.format("Row %d: Invalid field '%s': %s", position, field, detail));
    }
}
