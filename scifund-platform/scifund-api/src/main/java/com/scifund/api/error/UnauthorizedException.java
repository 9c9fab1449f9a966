package com.scifund.api.error;

public class UnauthorizedException extends LedgerException {

    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }
}
