package com.scifund.api.error;

public class LimitExceededException extends LedgerException {

    public LimitExceededException(String message) {
        super(ErrorKind.LIMIT_EXCEEDED, message);
    }
}
