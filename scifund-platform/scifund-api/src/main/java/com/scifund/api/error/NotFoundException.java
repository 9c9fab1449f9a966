package com.scifund.api.error;

public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
