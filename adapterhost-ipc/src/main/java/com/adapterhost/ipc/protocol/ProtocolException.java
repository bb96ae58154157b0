package com.adapterhost.ipc.protocol;

/** A frame that is not valid JSON or not a well-formed envelope. */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
