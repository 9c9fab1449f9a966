package com.scifund.api.error;

public class InvalidStateException extends LedgerException {

    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(ErrorKind.INVALID_STATE, message, cause);
    }
}
