package com.example.librarypanels.error.exception;

import com.example.librarypanels.error.LibraryPanelErrorCode;

public class InvalidRequestContextException extends BaseException {

    public InvalidRequestContextException(String detail) {
        super(LibraryPanelErrorCode.INVALID_REQUEST_CONTEXT, detail);
    }
}
