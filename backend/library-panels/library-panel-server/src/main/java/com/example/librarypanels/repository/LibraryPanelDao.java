package com.example.librarypanels.repository;

import com.example.librarypanels.context.RequestContext;
import com.example.librarypanels.error.exception.LibraryPanelAlreadyExistsException;
import com.example.librarypanels.error.exception.LibraryPanelInvariantViolationException;
import com.example.librarypanels.error.exception.LibraryPanelNotFoundException;
import com.example.librarypanels.model.LibraryPanelEntity;
import com.example.librarypanels.repository.jdbc.LibraryPanelRepository;
import com.example.librarypanels.uid.UidGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.relational.core.conversion.DbActionExecutionException;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Reads and writes library panels and turns storage outcomes into library panel errors. Every
 * method expects to run inside a transaction opened by the caller.
 */
@Repository
public class LibraryPanelDao {

    private static final Logger log = LoggerFactory.getLogger(LibraryPanelDao.class);

    private final LibraryPanelRepository libraryPanelRepository;
    private final UidGenerator uidGenerator;
    private final Clock clock;

    public LibraryPanelDao(LibraryPanelRepository libraryPanelRepository, UidGenerator uidGenerator, Clock clock) {
        this.libraryPanelRepository = libraryPanelRepository;
        this.uidGenerator = uidGenerator;
        this.clock = clock;
    }

    public LibraryPanelEntity create(RequestContext ctx, long folderId, String name, String model) {
        LocalDateTime now = now();
        LibraryPanelEntity panel = LibraryPanelEntity.builder()
                .orgId(ctx.orgId())
                .folderId(folderId)
                .uid(uidGenerator.generate())
                .name(name)
                .model(model)
                .created(now)
                .updated(now)
                .createdBy(ctx.userId())
                .updatedBy(ctx.userId())
                .build();
        try {
            return libraryPanelRepository.save(panel);
        } catch (DataAccessException | DbActionExecutionException e) {
            if (UniqueViolations.isUniqueViolation(e)) {
                throw new LibraryPanelAlreadyExistsException(panel.getUid(), e);
            }
            throw e;
        }
    }

    public LibraryPanelEntity get(String uid, long orgId) {
        List<LibraryPanelEntity> panels = libraryPanelRepository.findAllByUidAndOrgId(uid, orgId);
        if (panels.isEmpty()) {
            throw new LibraryPanelNotFoundException(uid);
        }
        if (panels.size() > 1) {
            log.error("Found {} library panels for uid='{}', orgId={}; uid uniqueness is broken in storage",
                    panels.size(), uid, orgId);
            throw new LibraryPanelInvariantViolationException(uid, panels.size());
        }
        return panels.get(0);
    }

    public List<LibraryPanelEntity> listAll(long orgId) {
        return libraryPanelRepository.findAllByOrgId(orgId);
    }

    /**
     * Merges the supplied values over the stored panel. A zero folder id, an empty name or a
     * {@code null} model keep what is stored.
     */
    public LibraryPanelEntity patch(RequestContext ctx, String uid, long folderId, String name, String model) {
        LibraryPanelEntity existing = get(uid, ctx.orgId());

        LibraryPanelEntity merged = existing.toBuilder()
                .folderId(folderId != 0 ? folderId : existing.getFolderId())
                .name(name != null && !name.isEmpty() ? name : existing.getName())
                .model(model != null ? model : existing.getModel())
                .updated(now())
                .updatedBy(ctx.userId())
                .build();

        int rowsAffected;
        try {
            rowsAffected = libraryPanelRepository.updateContent(
                    merged.getId(),
                    merged.getOrgId(),
                    merged.getFolderId(),
                    merged.getName(),
                    merged.getModel(),
                    merged.getUpdated(),
                    merged.getUpdatedBy());
        } catch (DataAccessException e) {
            if (UniqueViolations.isUniqueViolation(e)) {
                throw new LibraryPanelAlreadyExistsException(uid, e);
            }
            throw e;
        }
        if (rowsAffected != 1) {
            throw new LibraryPanelNotFoundException(uid);
        }
        return merged;
    }

    public void delete(String uid, long orgId) {
        int rowsAffected = libraryPanelRepository.deleteByUidAndOrgId(uid, orgId);
        if (rowsAffected != 1) {
            throw new LibraryPanelNotFoundException(uid);
        }
    }

    // Truncated to what TIMESTAMP columns keep, so the returned panel matches a later read.
    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
