package com.example.librarypanels.repository;

import com.example.librarypanels.error.exception.LibraryPanelConnectionNotFoundException;
import com.example.librarypanels.model.LibraryPanelDashboardEntity;
import com.example.librarypanels.model.LibraryPanelEntity;
import com.example.librarypanels.repository.jdbc.LibraryPanelDashboardRepository;
import com.example.librarypanels.transaction.TransactionScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.relational.core.conversion.DbActionExecutionException;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Connections between an already resolved library panel and dashboards. Dashboard ids are taken
 * as given; their existence is not checked.
 */
@Repository
public class LibraryPanelConnectionDao {

    private static final Logger log = LoggerFactory.getLogger(LibraryPanelConnectionDao.class);

    private final LibraryPanelDashboardRepository libraryPanelDashboardRepository;
    private final TransactionScope transactionScope;
    private final Clock clock;

    public LibraryPanelConnectionDao(LibraryPanelDashboardRepository libraryPanelDashboardRepository,
                                     TransactionScope transactionScope,
                                     Clock clock) {
        this.libraryPanelDashboardRepository = libraryPanelDashboardRepository;
        this.transactionScope = transactionScope;
        this.clock = clock;
    }

    /**
     * Idempotent: connecting a pair that is already connected succeeds without adding a row. The
     * insert runs under a savepoint so a duplicate only undoes itself. Spring Data JDBC reports a
     * failed insert as {@link DbActionExecutionException} around the translated cause.
     */
    public void connect(LibraryPanelEntity panel, long dashboardId, long actorId) {
        LibraryPanelDashboardEntity connection = new LibraryPanelDashboardEntity(
                panel.getId(),
                dashboardId,
                LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS),
                actorId);
        try {
            transactionScope.executeNested(status -> libraryPanelDashboardRepository.save(connection));
        } catch (DataAccessException | DbActionExecutionException e) {
            if (!UniqueViolations.isUniqueViolation(e)) {
                throw e;
            }
            log.debug("Library panel uid='{}' already connected to dashboardId={}", panel.getUid(), dashboardId);
        }
    }

    public void disconnect(LibraryPanelEntity panel, long dashboardId) {
        int rowsAffected = libraryPanelDashboardRepository.deleteByLibraryPanelIdAndDashboardId(panel.getId(), dashboardId);
        if (rowsAffected != 1) {
            throw new LibraryPanelConnectionNotFoundException(panel.getUid(), dashboardId);
        }
    }

    /** Dashboard ids connected to the panel. Iteration order carries no meaning. */
    public Set<Long> listForPanel(LibraryPanelEntity panel) {
        return new LinkedHashSet<>(libraryPanelDashboardRepository.findDashboardIdsByLibraryPanelId(panel.getId()));
    }
}
