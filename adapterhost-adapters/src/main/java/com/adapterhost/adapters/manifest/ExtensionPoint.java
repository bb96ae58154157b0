package com.adapterhost.adapters.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where an extension attaches: the target adapter token, the hook on that adapter, the method on the
 * extension to register, and a priority (higher runs first, default 0).
 */
public final class ExtensionPoint {

    private final String adapter;
    private final String hook;
    private final String method;
    private final int priority;

    @JsonCreator
    public ExtensionPoint(@JsonProperty("adapter") String adapter,
                          @JsonProperty("hook") String hook,
                          @JsonProperty("method") String method,
                          @JsonProperty("priority") Integer priority) {
        this.adapter = adapter;
        this.hook = hook;
        this.method = method;
        this.priority = priority != null ? priority : 0;
    }

    public String getAdapter() {
        return adapter;
    }

    public String getHook() {
        return hook;
    }

    public String getMethod() {
        return method;
    }

    public int getPriority() {
        return priority;
    }

    @Override
    public String toString() {
        return adapter + "." + hook + " <- " + method + " (priority " + priority + ")";
    }
}
