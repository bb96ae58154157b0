package com.adapterhost.adapters.manifest;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AdapterKind {
    /** Provides a capability directly. */
    @JsonProperty("core") CORE,
    /** Attaches to another adapter's hook. */
    @JsonProperty("extension") EXTENSION,
    /** Forwards a capability over IPC. */
    @JsonProperty("proxy") PROXY
}
