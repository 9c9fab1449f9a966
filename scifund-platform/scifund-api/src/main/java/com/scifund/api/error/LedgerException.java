package com.scifund.api.error;

/**
 * Base of all rejected ledger operations. Thrown before or instead of a commit,
 * so the ledger is unchanged when one escapes a service call.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorKind kind;

    protected LedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LedgerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
