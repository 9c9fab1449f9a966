package com.scifund.api.error;

/**
 * A funds movement could not be applied. Aborts the surrounding operation.
 */
public class TransferFailedException extends InvalidStateException {

    public TransferFailedException(String message) {
        super(message);
    }

    public TransferFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
