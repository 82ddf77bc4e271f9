package com.example.librarypanels.repository;

import org.springframework.dao.DuplicateKeyException;

import java.sql.SQLException;

/**
 * Recognizes unique-constraint violations however deep the driver or Spring Data wrapped them.
 */
public final class UniqueViolations {

    /** SQLSTATE for unique_violation, shared by PostgreSQL and H2. */
    static final String UNIQUE_VIOLATION = "23505";

    private UniqueViolations() {
        // Utility class
    }

    public static boolean isUniqueViolation(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof DuplicateKeyException) {
                return true;
            }
            if (current instanceof SQLException sqlException
                    && UNIQUE_VIOLATION.equals(sqlException.getSQLState())) {
                return true;
            }
            if (current.getCause() == current) {
                return false;
            }
            current = current.getCause();
        }
        return false;
    }
}
