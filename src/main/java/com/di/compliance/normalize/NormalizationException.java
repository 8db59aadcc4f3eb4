package com.di.compliance.normalize;

import com.di.compliance.exception.IngestionException;
import lombok.Getter;

/**
 * A raw field value could not be converted to its typed form. Row-level: the row fails, the document goes on.
 */
@Getter
public class NormalizationException extends IngestionException {

    public enum Condition {
        UNPARSEABLE_TEMPORAL("unparseable temporal value"),
        UNPARSEABLE_NUMERIC("unparseable numeric value"),
        UNKNOWN_ENUMERATION("unknown enumeration value");

        private final String label;

        Condition(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final Condition condition;
    private final String field;
    private final String rawValue;
    /** Enumeration family for {@link Condition#UNKNOWN_ENUMERATION}, otherwise null. */
    private final String family;

    public NormalizationException(Condition condition, String rawValue) {
        this(condition, null, rawValue, null);
    }

    public NormalizationException(Condition condition, String field, String rawValue, String family) {
        super(describe(condition, field, rawValue, family));
        this.condition = condition;
        this.field = field;
        this.rawValue = rawValue;
        this.family = family;
    }

    /**
     * Same condition attributed to a named field.
     */
    public NormalizationException forField(String fieldName) {
        NormalizationException named = new NormalizationException(condition, fieldName, rawValue, family);
        named.setStackTrace(getStackTrace());
        return named;
    }

    public static NormalizationException unknownEnumeration(String family, String rawValue) {
        return new NormalizationException(Condition.UNKNOWN_ENUMERATION, null, rawValue, family);
    }

    private static String describe(Condition condition, String field, String rawValue, String family) {
        StringBuilder sb = new StringBuilder(condition.getLabel());
        if (family != null) {
            sb.append(" for ").append(family);
        }
        if (field != null) {
            sb.append(" in field '").append(field).append('\'');
        }
        sb.append(": '").append(rawValue).append('\'');
        return sb.toString();
    }
}
