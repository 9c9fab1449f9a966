package com.scifund.api.error;

public class InvalidInputException extends LedgerException {

    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }
}
