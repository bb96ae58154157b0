package com.adapterhost.ipc.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Optional correlation data carried by a call: trace id, the sandbox's plugin id, session and tenant.
 * The host logs it with the call; it does not affect dispatch.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CallContext(String traceId, String pluginId, String sessionId, String tenantId) {

    public static final CallContext EMPTY = new CallContext(null, null, null, null);

    public static CallContext forPlugin(String pluginId) {
        return new CallContext(null, pluginId, null, null);
    }

    public CallContext withTraceId(String traceId) {
        return new CallContext(traceId, pluginId, sessionId, tenantId);
    }
}
