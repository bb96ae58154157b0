package com.adapterhost.loader;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A required dependency names a token that is not in the configuration set. The message lists every
 * configured token and, when some configured adapter's manifest id equals the missing token, points
 * out that dependencies are matched by token and not by manifest id.
 */
public final class MissingDependencyException extends AdapterConfigurationException {

    private final String missingToken;
    private final Set<String> configuredTokens;
    private final List<String> manifestIdMatches;

    public MissingDependencyException(String dependent, String missingToken, Set<String> configuredTokens,
                                      List<String> manifestIdMatches) {
        super(dependent, buildMessage(dependent, missingToken, configuredTokens, manifestIdMatches));
        this.missingToken = missingToken;
        this.configuredTokens = Collections.unmodifiableSet(new TreeSet<>(configuredTokens));
        this.manifestIdMatches = List.copyOf(manifestIdMatches);
    }

    private static String buildMessage(String dependent, String missing, Set<String> configured, List<String> matches) {
        StringBuilder sb = new StringBuilder()
                .append("Adapter '").append(dependent).append("' requires '").append(missing)
                .append("', which is not configured. Configured adapters: ").append(new TreeSet<>(configured));
        if (!matches.isEmpty()) {
            sb.append(". Hint: ").append(matches.size() == 1 ? "adapter " : "adapters ")
                    .append(matches).append(" declare manifest id '").append(missing)
                    .append("'; dependencies refer to configuration tokens, not manifest ids");
        }
        return sb.toString();
    }

    /** The dependent adapter's token. */
    public String getDependent() {
        return getToken();
    }

    public String getMissingToken() {
        return missingToken;
    }

    public Set<String> getConfiguredTokens() {
        return configuredTokens;
    }

    /** Configured tokens whose manifest id equals the missing token. */
    public List<String> getManifestIdMatches() {
        return manifestIdMatches;
    }
}
