package com.adapterhost.ipc.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response envelope, host to sandbox:
 * <pre>{"type":"adapter:response","requestId":"...","result":...}</pre>
 * or with {@code error} holding a serialized Error instead of {@code result}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AdapterResponse(String type, String requestId, JsonNode result, JsonNode error) {

    public AdapterResponse {
        type = type != null ? type : EnvelopeCodec.RESPONSE_TYPE;
    }

    public static AdapterResponse success(String requestId, JsonNode result) {
        return new AdapterResponse(EnvelopeCodec.RESPONSE_TYPE, requestId, result, null);
    }

    public static AdapterResponse failure(String requestId, JsonNode error) {
        return new AdapterResponse(EnvelopeCodec.RESPONSE_TYPE, requestId, null, error);
    }

    public boolean hasError() {
        return error != null && !error.isNull() && !error.isMissingNode();
    }

    public AdapterResponse withResult(JsonNode newResult) {
        return new AdapterResponse(type, requestId, newResult, error);
    }
}
