package com.example.librarypanels.error.exception;

import com.example.librarypanels.error.LibraryPanelErrorCode;

public class LibraryPanelAlreadyExistsException extends BaseException {

    public LibraryPanelAlreadyExistsException(String uid, Throwable cause) {
        super(LibraryPanelErrorCode.LIBRARY_PANEL_ALREADY_EXISTS, cause, uid);
    }
}
