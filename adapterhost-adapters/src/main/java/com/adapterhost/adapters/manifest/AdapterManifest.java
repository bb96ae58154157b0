package com.adapterhost.adapters.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Static description of an adapter: identity, the capability token it implements, required and
 * optional dependencies, and (for extensions) the hook it attaches to.
 * <p>
 * JSON shape:
 * <pre>
 * {
 *   "manifestVersion": "1.0",
 *   "id": "log-persistence",
 *   "name": "Log persistence",
 *   "version": "1.0.0",
 *   "type": "extension",
 *   "implements": "logPersistence",
 *   "requires": {"adapters": ["db"], "platform": "&gt;=1.0.0"},
 *   "optional": {"adapters": [{"id": "cache", "alias": "fastCache"}]},
 *   "extends": {"adapter": "logger", "hook": "onLog", "method": "write", "priority": 5},
 *   "capabilities": {"batch": true}
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AdapterManifest {

    public static final String CURRENT_MANIFEST_VERSION = "1.0";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String manifestVersion;
    private final String id;
    private final String name;
    private final String version;
    private final String description;
    private final AdapterKind type;
    private final String implementsToken;
    private final List<AdapterDependency> requires;
    private final String platform;
    private final List<AdapterDependency> optional;
    private final ExtensionPoint extendsPoint;
    private final AdapterCapabilities capabilities;

    @JsonCreator
    public AdapterManifest(@JsonProperty("manifestVersion") String manifestVersion,
                           @JsonProperty("id") String id,
                           @JsonProperty("name") String name,
                           @JsonProperty("version") String version,
                           @JsonProperty("description") String description,
                           @JsonProperty("type") AdapterKind type,
                           @JsonProperty("implements") String implementsToken,
                           @JsonProperty("requires") Requirements requires,
                           @JsonProperty("optional") Requirements optional,
                           @JsonProperty("extends") ExtensionPoint extendsPoint,
                           @JsonProperty("capabilities") AdapterCapabilities capabilities) {
        this.manifestVersion = manifestVersion != null ? manifestVersion : CURRENT_MANIFEST_VERSION;
        this.id = id;
        this.name = name != null ? name : id;
        this.version = version != null ? version : "0.0.0";
        this.description = description;
        this.type = type != null ? type : AdapterKind.CORE;
        this.implementsToken = implementsToken;
        this.requires = requires != null ? requires.getAdapters() : List.of();
        this.platform = requires != null ? requires.getPlatform() : null;
        this.optional = optional != null ? optional.getAdapters() : List.of();
        this.extendsPoint = extendsPoint;
        this.capabilities = capabilities != null ? capabilities : AdapterCapabilities.NONE;
    }

    public static AdapterManifest fromJson(String json) {
        try {
            return MAPPER.readValue(json, AdapterManifest.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid adapter manifest: " + e.getMessage(), e);
        }
    }

    public static Builder builder(String id, String implementsToken) {
        return new Builder(id, implementsToken);
    }

    /**
     * Structural checks: non-blank id and implements, non-blank dependency ids, an extends
     * declaration when the type is {@link AdapterKind#EXTENSION}, and adapter, hook and method on
     * any extends declaration present.
     *
     * @throws IllegalArgumentException describing every problem found
     */
    public AdapterManifest validate() {
        List<String> problems = new ArrayList<>();
        if (id == null || id.isBlank()) problems.add("id is required");
        if (implementsToken == null || implementsToken.isBlank()) problems.add("implements is required");
        for (AdapterDependency dep : requires) {
            if (dep.getId().isEmpty()) problems.add("requires.adapters contains a blank id");
        }
        for (AdapterDependency dep : optional) {
            if (dep.getId().isEmpty()) problems.add("optional.adapters contains a blank id");
        }
        if (type == AdapterKind.EXTENSION && extendsPoint == null) {
            problems.add("extension adapters must declare extends");
        }
        if (extendsPoint != null
                && (isBlank(extendsPoint.getAdapter()) || isBlank(extendsPoint.getHook()) || isBlank(extendsPoint.getMethod()))) {
            problems.add("extends needs adapter, hook and method");
        }
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid manifest '" + id + "': " + String.join("; ", problems));
        }
        return this;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public String getManifestVersion() {
        return manifestVersion;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public AdapterKind getType() {
        return type;
    }

    /** Capability token this adapter provides, e.g. {@code database.document}. */
    public String getImplements() {
        return implementsToken;
    }

    public List<AdapterDependency> getRequires() {
        return requires;
    }

    /** Platform version range from {@code requires.platform}; informational. */
    public String getPlatform() {
        return platform;
    }

    public List<AdapterDependency> getOptional() {
        return optional;
    }

    /** Extension point, or null for non-extension adapters. */
    public ExtensionPoint getExtends() {
        return extendsPoint;
    }

    public AdapterCapabilities getCapabilities() {
        return capabilities;
    }

    @Override
    public String toString() {
        return "AdapterManifest{" + id + "@" + version + " implements " + implementsToken + "}";
    }

    /** {@code requires} / {@code optional} block. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Requirements {
        private final List<AdapterDependency> adapters;
        private final String platform;

        @JsonCreator
        public Requirements(@JsonProperty("adapters") List<AdapterDependency> adapters,
                            @JsonProperty("platform") String platform) {
            this.adapters = adapters != null ? Collections.unmodifiableList(new ArrayList<>(adapters)) : List.of();
            this.platform = platform;
        }

        public List<AdapterDependency> getAdapters() {
            return adapters;
        }

        public String getPlatform() {
            return platform;
        }
    }

    public static final class Builder {
        private final String id;
        private final String implementsToken;
        private String name;
        private String version;
        private String description;
        private AdapterKind type = AdapterKind.CORE;
        private final List<AdapterDependency> requires = new ArrayList<>();
        private final List<AdapterDependency> optional = new ArrayList<>();
        private ExtensionPoint extendsPoint;
        private AdapterCapabilities capabilities;

        private Builder(String id, String implementsToken) {
            this.id = Objects.requireNonNull(id, "id");
            this.implementsToken = Objects.requireNonNull(implementsToken, "implementsToken");
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(AdapterKind type) {
            this.type = Objects.requireNonNull(type, "type");
            return this;
        }

        public Builder requires(String token) {
            requires.add(AdapterDependency.of(token));
            return this;
        }

        public Builder requires(String token, String alias) {
            requires.add(AdapterDependency.aliased(token, alias));
            return this;
        }

        public Builder optional(String token) {
            optional.add(AdapterDependency.of(token));
            return this;
        }

        public Builder optional(String token, String alias) {
            optional.add(AdapterDependency.aliased(token, alias));
            return this;
        }

        /** Marks the adapter as an extension attached to {@code adapter.hook}. */
        public Builder extendsHook(String adapter, String hook, String method, int priority) {
            this.type = AdapterKind.EXTENSION;
            this.extendsPoint = new ExtensionPoint(adapter, hook, method, priority);
            return this;
        }

        public Builder capabilities(AdapterCapabilities capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public AdapterManifest build() {
            return new AdapterManifest(CURRENT_MANIFEST_VERSION, id, name, version, description, type, implementsToken,
                    new Requirements(requires, null), new Requirements(optional, null), extendsPoint, capabilities);
        }
    }
}
