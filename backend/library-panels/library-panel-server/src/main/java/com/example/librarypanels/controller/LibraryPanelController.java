package com.example.librarypanels.controller;

import com.example.librarypanels.api.dto.CreateLibraryPanelRequest;
import com.example.librarypanels.api.dto.PatchLibraryPanelRequest;
import com.example.librarypanels.api.model.LibraryPanel;
import com.example.librarypanels.context.RequestContext;
import com.example.librarypanels.service.LibraryPanelService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;

import static com.example.librarypanels.controller.RequestContextResolver.ORG_ID_HEADER;
import static com.example.librarypanels.controller.RequestContextResolver.REQUEST_TIMEOUT_HEADER;
import static com.example.librarypanels.controller.RequestContextResolver.USER_ID_HEADER;

@RestController
@RequestMapping("/api/v1/library-panels")
@Tag(name = "Library Panels", description = "Reusable panels and their dashboard connections")
public class LibraryPanelController {

    private static final Logger log = LoggerFactory.getLogger(LibraryPanelController.class);
    private final LibraryPanelService libraryPanelService;
    private final RequestContextResolver contextResolver;

    public LibraryPanelController(LibraryPanelService libraryPanelService, RequestContextResolver contextResolver) {
        this.libraryPanelService = libraryPanelService;
        this.contextResolver = contextResolver;
    }

    @Operation(summary = "Create library panel", description = "Stores a new library panel under a freshly generated uid")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Library panel created",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                schema = @Schema(implementation = LibraryPanel.class))),
        @ApiResponse(responseCode = "409", description = "Generated uid collided with an existing panel")
    })
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public LibraryPanel createLibraryPanel(
        @RequestHeader(ORG_ID_HEADER) long orgId,
        @RequestHeader(USER_ID_HEADER) long userId,
        @RequestHeader(value = REQUEST_TIMEOUT_HEADER, required = false) String timeout,
        @RequestBody CreateLibraryPanelRequest request
    ) {
        log.info("Creating library panel: name='{}', folderId={}, orgId={}", request.name(), request.folderId(), orgId);
        return libraryPanelService.createLibraryPanel(contextResolver.resolve(orgId, userId, timeout), request);
    }

    @Operation(summary = "List library panels", description = "Returns every library panel of the caller's organization, in no particular order")
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<LibraryPanel> getAllLibraryPanels(
        @RequestHeader(ORG_ID_HEADER) long orgId,
        @RequestHeader(USER_ID_HEADER) long userId,
        @RequestHeader(value = REQUEST_TIMEOUT_HEADER, required = false) String timeout
    ) {
        return libraryPanelService.getAllLibraryPanels(contextResolver.resolve(orgId, userId, timeout));
    }

    @Operation(summary = "Get library panel")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Library panel found"),
        @ApiResponse(responseCode = "404", description = "No library panel with that uid in the organization")
    })
    @GetMapping(value = "/{uid}", produces = MediaType.APPLICATION_JSON_VALUE)
    public LibraryPanel getLibraryPanel(
        @RequestHeader(ORG_ID_HEADER) long orgId,
        @RequestHeader(USER_ID_HEADER) long userId,
        @RequestHeader(value = REQUEST_TIMEOUT_HEADER, required = false) String timeout,
        @Parameter(description = "Library panel uid", example = "a1B2c3D4e", required = true)
        @PathVariable String uid
    ) {
        return libraryPanelService.getLibraryPanel(contextResolver.resolve(orgId, userId, timeout), uid);
    }

    @Operation(summary = "Patch library panel",
        description = "Merges the supplied fields over the stored panel; zero folderId, empty name and missing model keep the stored values")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Library panel updated"),
        @ApiResponse(responseCode = "404", description = "No library panel with that uid in the organization"),
        @ApiResponse(responseCode = "409", description = "Update conflicts with an existing panel")
    })
    @PatchMapping(value = "/{uid}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public LibraryPanel patchLibraryPanel(
        @RequestHeader(ORG_ID_HEADER) long orgId,
        @RequestHeader(USER_ID_HEADER) long userId,
        @RequestHeader(value = REQUEST_TIMEOUT_HEADER, required = false) String timeout,
        @PathVariable String uid,
        @RequestBody PatchLibraryPanelRequest request
    ) {
        log.info("Patching library panel uid='{}', orgId={}", uid, orgId);
        return libraryPanelService.patchLibraryPanel(contextResolver.resolve(orgId, userId, timeout), uid, request);
    }

    @Operation(summary = "Delete library panel", description = "Hard delete; connections to dashboards are kept")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "204", description = "Library panel deleted"),
        @ApiResponse(responseCode = "404", description = "No library panel with that uid in the organization")
    })
    @DeleteMapping("/{uid}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteLibraryPanel(
        @RequestHeader(ORG_ID_HEADER) long orgId,
        @RequestHeader(USER_ID_HEADER) long userId,
        @RequestHeader(value = REQUEST_TIMEOUT_HEADER, required = false) String timeout,
        @PathVariable String uid
    ) {
        log.info("Deleting library panel uid='{}', orgId={}", uid, orgId);
        libraryPanelService.deleteLibraryPanel(contextResolver.resolve(orgId, userId, timeout), uid);
    }

    @Operation(summary = "Get connected dashboards", description = "Returns the ids of dashboards using the panel, in no particular order")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Dashboard ids",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                schema = @Schema(type = "array", implementation = Long.class))),
        @ApiResponse(responseCode = "404", description = "No library panel with that uid in the organization")
    })
    @GetMapping(value = "/{uid}/dashboards", produces = MediaType.APPLICATION_JSON_VALUE)
    public Set<Long> getConnectedDashboards(
        @RequestHeader(ORG_ID_HEADER) long orgId,
        @RequestHeader(USER_ID_HEADER) long userId,
        @RequestHeader(value = REQUEST_TIMEOUT_HEADER, required = false) String timeout,
        @PathVariable String uid
    ) {
        return libraryPanelService.getConnectedDashboards(contextResolver.resolve(orgId, userId, timeout), uid);
    }

    @Operation(summary = "Connect dashboard", description = "Idempotent; connecting an already connected dashboard succeeds")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "204", description = "Dashboard connected"),
        @ApiResponse(responseCode = "404", description = "No library panel with that uid in the organization")
    })
    @PostMapping("/{uid}/dashboards/{dashboardId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void connectDashboard(
        @RequestHeader(ORG_ID_HEADER) long orgId,
        @RequestHeader(USER_ID_HEADER) long userId,
        @RequestHeader(value = REQUEST_TIMEOUT_HEADER, required = false) String timeout,
        @PathVariable String uid,
        @Parameter(description = "Dashboard identifier", example = "100", required = true)
        @PathVariable long dashboardId
    ) {
        log.info("Connecting library panel uid='{}' to dashboardId={}", uid, dashboardId);
        libraryPanelService.connectDashboard(contextResolver.resolve(orgId, userId, timeout), uid, dashboardId);
    }

    @Operation(summary = "Disconnect dashboard")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "204", description = "Dashboard disconnected"),
        @ApiResponse(responseCode = "404", description = "Panel not found, or panel not connected to the dashboard")
    })
    @DeleteMapping("/{uid}/dashboards/{dashboardId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void disconnectDashboard(
        @RequestHeader(ORG_ID_HEADER) long orgId,
        @RequestHeader(USER_ID_HEADER) long userId,
        @RequestHeader(value = REQUEST_TIMEOUT_HEADER, required = false) String timeout,
        @PathVariable String uid,
        @PathVariable long dashboardId
    ) {
        log.info("Disconnecting library panel uid='{}' from dashboardId={}", uid, dashboardId);
        RequestContext ctx = contextResolver.resolve(orgId, userId, timeout);
        libraryPanelService.disconnectDashboard(ctx, uid, dashboardId);
    }
}
