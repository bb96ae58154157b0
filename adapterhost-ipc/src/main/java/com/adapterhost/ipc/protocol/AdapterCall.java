package com.adapterhost.ipc.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Call envelope, sandbox to host:
 * <pre>{"type":"adapter:call","requestId":"...","version":2,"adapter":"cache","method":"get","args":[...],"context":{...}}</pre>
 * Arguments are already in wire form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AdapterCall(String type, String requestId, int version, String adapter, String method,
                          List<JsonNode> args, CallContext context) {

    public AdapterCall {
        type = type != null ? type : EnvelopeCodec.CALL_TYPE;
        List<JsonNode> copy = new ArrayList<>();
        if (args != null) {
            for (JsonNode arg : args) {
                copy.add(arg != null ? arg : NullNode.getInstance());
            }
        }
        args = Collections.unmodifiableList(copy);
    }

    public static AdapterCall create(String requestId, String adapter, String method, List<JsonNode> args, CallContext context) {
        return new AdapterCall(EnvelopeCodec.CALL_TYPE, requestId, EnvelopeCodec.PROTOCOL_VERSION, adapter, method, args, context);
    }

    /** "adapter.method", for logs and metrics. */
    public String operation() {
        return adapter + "." + method;
    }
}
