package com.di.compliance.util;

import com.di.compliance.exception.DocumentRegistrationException;
import com.di.compliance.exception.ExtractionException;
import com.di.compliance.normalize.NormalizationException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.TransactionException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error categories used to label fatal document failures in logs and run metadata.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a category: add the constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection"),
    CONSTRAINT_VIOLATION("Database constraint violation", "Database constraint check failed"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or semantic error"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back"),
    DATABASE_ERROR("Database error", "General database operation error"),
    REGISTRATION_ERROR("Registration error", "Document could not be recorded in the registry"),
    EXTRACTION_ERROR("Extraction error", "Document could not be opened, decoded or classified"),
    NORMALIZATION_ERROR("Normalization error", "Field value could not be converted to its typed form"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    RESOURCE_ERROR("Resource error", "File system or memory resource unavailable"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof ExtractionException, EXTRACTION_ERROR);
        MATCHERS.put(t -> t instanceof NormalizationException, NORMALIZATION_ERROR);
        MATCHERS.put(t -> t instanceof DocumentRegistrationException, REGISTRATION_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof DocumentRegistrationException && exception.getCause() != null) {
            return categorize(exception.getCause());
        }
        if (exception instanceof DataAccessException dae) {
            return categorizeDataAccess(dae);
        }
        if (exception instanceof TransactionException) {
            return TRANSACTION_ROLLBACK;
        }
        if (exception instanceof SQLException sqlEx) {
            return categorizeSqlException(sqlEx);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    private static ErrorCategory categorizeDataAccess(DataAccessException dae) {
        if (dae instanceof DataIntegrityViolationException) {
            return CONSTRAINT_VIOLATION;
        }
        if (dae instanceof QueryTimeoutException) {
            return TIMEOUT_ERROR;
        }
        if (dae instanceof DataAccessResourceFailureException) {
            return CONNECTION_ERROR;
        }
        Throwable cause = dae.getMostSpecificCause();
        if (cause instanceof SQLException sqlEx) {
            return categorizeSqlException(sqlEx);
        }
        return DATABASE_ERROR;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase(Locale.ROOT);
            if (containsAny(lower, "connection", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "constraint", "unique", "foreign key")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "syntax", "parse error")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK
    );

    // --- Matcher helpers ---

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof java.io.IOException
                || t instanceof java.io.UncheckedIOException;
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
