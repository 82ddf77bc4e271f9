package com.example.librarypanels.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Unique violation classification")
class UniqueViolationsTest {

    @Test
    @DisplayName("Should recognize Spring's translated duplicate key exception")
    void shouldRecognizeDuplicateKeyException() {
        assertThat(UniqueViolations.isUniqueViolation(new DuplicateKeyException("duplicate"))).isTrue();
    }

    @Test
    @DisplayName("Should recognize a unique_violation SQL state nested in the cause chain")
    void shouldRecognizeNestedSqlState() {
        SQLException sqlException = new SQLException("duplicate key value", "23505");
        RuntimeException wrapped = new IllegalStateException("insert failed",
                new DataIntegrityViolationException("integrity", sqlException));

        assertThat(UniqueViolations.isUniqueViolation(wrapped)).isTrue();
    }

    @Test
    @DisplayName("Should not treat other integrity violations as unique violations")
    void shouldIgnoreOtherIntegrityViolations() {
        SQLException notNull = new SQLException("null value in column", "23502");

        assertThat(UniqueViolations.isUniqueViolation(new DataIntegrityViolationException("integrity", notNull))).isFalse();
        assertThat(UniqueViolations.isUniqueViolation(null)).isFalse();
    }
}
