package com.example.librarypanels.repository;

import com.example.librarypanels.model.LibraryPanelEntity;
import com.example.librarypanels.repository.jdbc.LibraryPanelDashboardRepository;
import com.example.librarypanels.transaction.TransactionScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.relational.core.conversion.DbActionExecutionException;
import org.springframework.transaction.support.TransactionCallback;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LibraryPanelConnectionDao error classification")
class LibraryPanelConnectionDaoUnitTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Mock
    private LibraryPanelDashboardRepository libraryPanelDashboardRepository;

    @Mock
    private TransactionScope transactionScope;

    private LibraryPanelConnectionDao connectionDao;

    private final LibraryPanelEntity panel = LibraryPanelEntity.builder()
            .id(7L)
            .orgId(1L)
            .uid("abc123xyz")
            .build();

    @BeforeEach
    void setUp() {
        connectionDao = new LibraryPanelConnectionDao(libraryPanelDashboardRepository, transactionScope, CLOCK);
        when(transactionScope.executeNested(any()))
                .thenAnswer(invocation -> ((TransactionCallback<?>) invocation.getArgument(0)).doInTransaction(null));
    }

    @Test
    @DisplayName("Should treat a duplicate connection reported by the insert as success")
    void shouldIgnoreWrappedDuplicateConnection() {
        when(libraryPanelDashboardRepository.save(any()))
                .thenThrow(new DbActionExecutionException(null, new DuplicateKeyException("uq_library_panel_dashboard")));

        assertThatCode(() -> connectionDao.connect(panel, 100L, 42L)).doesNotThrowAnyException();
        verify(transactionScope).executeNested(any());
    }

    @Test
    @DisplayName("Should rethrow a wrapped integrity failure that is not a unique violation")
    void shouldRethrowWrappedIntegrityFailure() {
        DbActionExecutionException failure =
                new DbActionExecutionException(null, new DataIntegrityViolationException("not-null violated"));
        when(libraryPanelDashboardRepository.save(any())).thenThrow(failure);

        assertThatThrownBy(() -> connectionDao.connect(panel, 100L, 42L)).isSameAs(failure);
    }

    @Test
    @DisplayName("Should rethrow an unwrapped integrity failure that is not a unique violation")
    void shouldRethrowIntegrityFailure() {
        DataIntegrityViolationException failure = new DataIntegrityViolationException("not-null violated");
        when(libraryPanelDashboardRepository.save(any())).thenThrow(failure);

        assertThatThrownBy(() -> connectionDao.connect(panel, 100L, 42L)).isSameAs(failure);
    }
}
