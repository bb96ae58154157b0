package com.adapterhost.adapters.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A declared dependency on another adapter token. In JSON either the short form {@code "db"} or the
 * long form {@code {"id":"db","alias":"database"}}. The alias is the name under which the dependency
 * appears in the dependent's bundle; it defaults to the token.
 */
public final class AdapterDependency {

    private final String id;
    private final String alias;

    @JsonCreator
    public AdapterDependency(@JsonProperty("id") String id, @JsonProperty("alias") String alias) {
        this.id = id != null ? id.trim() : "";
        this.alias = alias != null && !alias.isBlank() ? alias.trim() : null;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AdapterDependency of(String id) {
        return new AdapterDependency(id, null);
    }

    public static AdapterDependency aliased(String id, String alias) {
        return new AdapterDependency(id, alias);
    }

    /** Token of the adapter depended on. */
    public String getId() {
        return id;
    }

    /** Explicit alias, or null when the token is used. */
    public String getAlias() {
        return alias;
    }

    @JsonIgnore
    public String getEffectiveAlias() {
        return alias != null ? alias : id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AdapterDependency)) return false;
        AdapterDependency that = (AdapterDependency) o;
        return id.equals(that.id) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, alias);
    }

    @Override
    public String toString() {
        return alias != null ? id + " as " + alias : id;
    }
}
