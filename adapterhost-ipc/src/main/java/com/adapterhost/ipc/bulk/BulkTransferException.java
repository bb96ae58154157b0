package com.adapterhost.ipc.bulk;

/** The bulk side channel could not write, read or validate a payload file. */
public final class BulkTransferException extends RuntimeException {

    public BulkTransferException(String message) {
        super(message);
    }

    public BulkTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
