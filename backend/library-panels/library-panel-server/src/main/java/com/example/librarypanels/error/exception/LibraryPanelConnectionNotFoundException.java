package com.example.librarypanels.error.exception;

import com.example.librarypanels.error.LibraryPanelErrorCode;

/**
 * Thrown when a panel exists but has no connection to the given dashboard.
 */
public class LibraryPanelConnectionNotFoundException extends BaseException {

    public LibraryPanelConnectionNotFoundException(String uid, long dashboardId) {
        super(LibraryPanelErrorCode.LIBRARY_PANEL_CONNECTION_NOT_FOUND, uid, dashboardId);
    }
}
