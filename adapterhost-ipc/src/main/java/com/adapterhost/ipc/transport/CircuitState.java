package com.adapterhost.ipc.transport;

public enum CircuitState {
    /** Calls flow; consecutive failures are counted. */
    CLOSED,
    /** Calls fail fast until the cooldown elapses. */
    OPEN,
    /** One trial call is allowed; its outcome closes or reopens the circuit. */
    HALF_OPEN
}
