package com.adapterhost.internal.adapters.sql;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.manifest.AdapterCapabilities;
import com.adapterhost.adapters.manifest.AdapterManifest;
import com.adapterhost.loader.AdapterDependencies;
import com.adapterhost.loader.AdapterModule;
import com.adapterhost.loader.AdapterSettings;

/**
 * Settings: {@code url} (JDBC URL, required), {@code user} and {@code password} (optional). The
 * driver must be on the host's classpath.
 */
public final class JdbcSqlDatabaseModule implements AdapterModule {

    public static final String ID = "jdbc-sql";

    private static final AdapterManifest MANIFEST = AdapterManifest.builder(ID, AdapterTokens.SQL_DATABASE)
            .name("JDBC SQL database")
            .version("1.0.0")
            .description("Parameterized SQL and transactions through a JDBC driver")
            .capabilities(new AdapterCapabilities(false, false, false, true, null))
            .build();

    @Override
    public AdapterManifest manifest() {
        return MANIFEST;
    }

    @Override
    public Object create(AdapterSettings settings, AdapterDependencies dependencies) {
        String url = settings.getString("url", null);
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException(ID + " needs a 'url' setting");
        }
        return JdbcSqlDatabase.forUrl(url, settings.getString("user", null), settings.getString("password", null));
    }
}
