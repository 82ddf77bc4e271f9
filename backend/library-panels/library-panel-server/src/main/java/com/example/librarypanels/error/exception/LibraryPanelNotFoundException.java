package com.example.librarypanels.error.exception;

import com.example.librarypanels.error.LibraryPanelErrorCode;

public class LibraryPanelNotFoundException extends BaseException {

    public LibraryPanelNotFoundException(String uid) {
        super(LibraryPanelErrorCode.LIBRARY_PANEL_NOT_FOUND, uid);
    }
}
