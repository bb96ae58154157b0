package com.adapterhost.ipc.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** Method table of one exposed adapter. */
public final class AdapterEndpoint {

    private final Map<String, MethodHandler> methods;

    private AdapterEndpoint(Map<String, MethodHandler> methods) {
        this.methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
    }

    public static Builder builder() {
        return new Builder();
    }

    public MethodHandler method(String name) {
        return methods.get(name);
    }

    public Set<String> methodNames() {
        return methods.keySet();
    }

    public static final class Builder {
        private final Map<String, MethodHandler> methods = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder method(String name, MethodHandler handler) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(handler, "handler");
            if (methods.putIfAbsent(name, handler) != null) {
                throw new IllegalArgumentException("Method already defined: " + name);
            }
            return this;
        }

        public AdapterEndpoint build() {
            return new AdapterEndpoint(methods);
        }
    }
}
