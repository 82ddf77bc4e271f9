package com.example.librarypanels.service;

import com.example.librarypanels.api.dto.CreateLibraryPanelRequest;
import com.example.librarypanels.api.dto.PatchLibraryPanelRequest;
import com.example.librarypanels.api.model.LibraryPanel;
import com.example.librarypanels.context.RequestContext;
import com.example.librarypanels.mapper.LibraryPanelMapper;
import com.example.librarypanels.model.LibraryPanelEntity;
import com.example.librarypanels.repository.LibraryPanelConnectionDao;
import com.example.librarypanels.repository.LibraryPanelDao;
import com.example.librarypanels.transaction.TransactionScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Library panel operations. Each call is one transaction, so the lookup that resolves a panel and
 * the write that depends on it cannot interleave with another transaction's write to that row.
 */
@Service
public class LibraryPanelService {

    private static final Logger log = LoggerFactory.getLogger(LibraryPanelService.class);

    private final LibraryPanelDao libraryPanelDao;
    private final LibraryPanelConnectionDao connectionDao;
    private final TransactionScope transactionScope;
    private final LibraryPanelMapper mapper;

    public LibraryPanelService(LibraryPanelDao libraryPanelDao,
                               LibraryPanelConnectionDao connectionDao,
                               TransactionScope transactionScope,
                               LibraryPanelMapper mapper) {
        this.libraryPanelDao = libraryPanelDao;
        this.connectionDao = connectionDao;
        this.transactionScope = transactionScope;
        this.mapper = mapper;
    }

    public LibraryPanel createLibraryPanel(RequestContext ctx, CreateLibraryPanelRequest request) {
        String model = mapper.writeModel(request.model());
        LibraryPanelEntity created = transactionScope.execute(ctx, status ->
                libraryPanelDao.create(ctx, request.folderId(), request.name(), model));
        log.info("Library panel created with uid='{}', orgId={}, userId={}", created.getUid(), ctx.orgId(), ctx.userId());
        return mapper.toDto(created);
    }

    public LibraryPanel getLibraryPanel(RequestContext ctx, String uid) {
        log.debug("Fetching library panel uid='{}', orgId={}", uid, ctx.orgId());
        LibraryPanelEntity panel = transactionScope.executeReadOnly(ctx, status ->
                libraryPanelDao.get(uid, ctx.orgId()));
        return mapper.toDto(panel);
    }

    public List<LibraryPanel> getAllLibraryPanels(RequestContext ctx) {
        log.debug("Fetching all library panels for orgId={}", ctx.orgId());
        List<LibraryPanelEntity> panels = transactionScope.executeReadOnly(ctx, status ->
                libraryPanelDao.listAll(ctx.orgId()));
        return panels.stream()
                .map(mapper::toDto)
                .collect(Collectors.toList());
    }

    public LibraryPanel patchLibraryPanel(RequestContext ctx, String uid, PatchLibraryPanelRequest request) {
        String model = request.hasModel() ? mapper.writeModel(request.model()) : null;
        LibraryPanelEntity patched = transactionScope.execute(ctx, status ->
                libraryPanelDao.patch(ctx, uid, request.folderId(), request.name(), model));
        log.info("Library panel patched uid='{}', orgId={}, userId={}", uid, ctx.orgId(), ctx.userId());
        return mapper.toDto(patched);
    }

    /** Connection rows of the deleted panel are left in place. */
    public void deleteLibraryPanel(RequestContext ctx, String uid) {
        transactionScope.executeWithoutResult(ctx, status -> libraryPanelDao.delete(uid, ctx.orgId()));
        log.info("Library panel deleted uid='{}', orgId={}, userId={}", uid, ctx.orgId(), ctx.userId());
    }

    public void connectDashboard(RequestContext ctx, String uid, long dashboardId) {
        transactionScope.executeWithoutResult(ctx, status -> {
            LibraryPanelEntity panel = libraryPanelDao.get(uid, ctx.orgId());
            connectionDao.connect(panel, dashboardId, ctx.userId());
        });
        log.info("Library panel uid='{}' connected to dashboardId={}, orgId={}", uid, dashboardId, ctx.orgId());
    }

    public void disconnectDashboard(RequestContext ctx, String uid, long dashboardId) {
        transactionScope.executeWithoutResult(ctx, status -> {
            LibraryPanelEntity panel = libraryPanelDao.get(uid, ctx.orgId());
            connectionDao.disconnect(panel, dashboardId);
        });
        log.info("Library panel uid='{}' disconnected from dashboardId={}, orgId={}", uid, dashboardId, ctx.orgId());
    }

    public Set<Long> getConnectedDashboards(RequestContext ctx, String uid) {
        log.debug("Fetching dashboards connected to library panel uid='{}', orgId={}", uid, ctx.orgId());
        return transactionScope.executeReadOnly(ctx, status -> {
            LibraryPanelEntity panel = libraryPanelDao.get(uid, ctx.orgId());
            return connectionDao.listForPanel(panel);
        });
    }
}
