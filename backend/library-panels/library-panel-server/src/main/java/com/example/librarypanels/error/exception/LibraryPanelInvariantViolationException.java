package com.example.librarypanels.error.exception;

import com.example.librarypanels.error.LibraryPanelErrorCode;

/**
 * More than one row matched a lookup that the uid uniqueness constraint guarantees to be unique.
 * The stored data is corrupt; this is never a normal "not found".
 */
public class LibraryPanelInvariantViolationException extends BaseException {

    public LibraryPanelInvariantViolationException(String uid, int matches) {
        super(LibraryPanelErrorCode.LIBRARY_PANEL_INVARIANT_VIOLATION, matches, uid);
    }
}
