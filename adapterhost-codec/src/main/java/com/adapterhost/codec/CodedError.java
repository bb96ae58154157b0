package com.adapterhost.codec;

/**
 * Implemented by exceptions that carry a machine-readable code. The code is written into the
 * serialized error and restored on the receiving side.
 */
public interface CodedError {

    /** Error code such as {@code ADAPTER_NOT_FOUND}; may be null. */
    String getCode();
}
