package com.adapterhost.loader;

import com.adapterhost.adapters.manifest.AdapterManifest;
import com.adapterhost.adapters.manifest.ExtensionPoint;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.adapterhost.loader.TestModules.HookTarget;
import static com.adapterhost.loader.TestModules.Named;
import static com.adapterhost.loader.TestModules.Recorder;
import static com.adapterhost.loader.TestModules.RecordingObserver;
import static com.adapterhost.loader.TestModules.module;
import static com.adapterhost.loader.TestModules.named;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdapterLoaderTest {

    private final RecordingObserver observer = new RecordingObserver();
    private final AdapterLoader loader = new AdapterLoader(new MapModuleResolver(), observer);

    @Test
    void load_createsDependencyFirstAndBindsItUnderItsToken() {
        Map<String, AdapterConfig> configs = new LinkedHashMap<>();
        configs.put("logPersistence", AdapterConfig.of(named(AdapterManifest.builder("persist", "logPersistence").requires("db").build())));
        configs.put("db", AdapterConfig.of(named(AdapterManifest.builder("memdb", "db").build())));

        LoadedAdapters loaded = loader.load(configs);

        assertEquals(List.of("db", "logPersistence"), loaded.getLoadOrder());
        Named persistence = loaded.get("logPersistence", Named.class);
        assertSame(loaded.get("db"), persistence.dependencies.get("db"));
        assertEquals(Set.of("db"), persistence.dependencies.aliases());
    }

    @Test
    void load_bindsAliasedDependency() {
        Map<String, AdapterConfig> configs = new LinkedHashMap<>();
        configs.put("db", AdapterConfig.of(named(AdapterManifest.builder("memdb", "db").build())));
        configs.put("service", AdapterConfig.of(named(AdapterManifest.builder("svc", "service").requires("db", "database").build())));

        LoadedAdapters loaded = loader.load(configs);

        Named service = loaded.get("service", Named.class);
        assertSame(loaded.get("db"), service.dependencies.get("database"));
        assertFalse(service.dependencies.has("db"));
    }

    @Test
    void load_optionalDependencyIsBoundOnlyWhenConfigured() {
        AdapterManifest withOptional = AdapterManifest.builder("svc", "service").optional("metrics").build();

        LoadedAdapters without = loader.load(Map.of("service", AdapterConfig.of(named(withOptional))));
        assertTrue(without.get("service", Named.class).dependencies.aliases().isEmpty());

        Map<String, AdapterConfig> configs = new LinkedHashMap<>();
        configs.put("service", AdapterConfig.of(named(withOptional)));
        configs.put("metrics", AdapterConfig.of(named(AdapterManifest.builder("m", "metrics").build())));
        LoadedAdapters with = loader.load(configs);

        assertEquals(List.of("metrics", "service"), with.getLoadOrder());
        assertSame(with.get("metrics"), with.get("service", Named.class).dependencies.get("metrics"));
    }

    @Test
    void load_missingDependencyNamesDependentMissingAndConfigured() {
        Map<String, AdapterConfig> configs = new LinkedHashMap<>();
        configs.put("logger", AdapterConfig.of(named(AdapterManifest.builder("log", "logger").build())));
        configs.put("logPersistence", AdapterConfig.of(named(AdapterManifest.builder("persist", "logPersistence").requires("db").build())));

        MissingDependencyException e = assertThrows(MissingDependencyException.class, () -> loader.load(configs));

        assertEquals("logPersistence", e.getDependent());
        assertEquals("db", e.getMissingToken());
        assertEquals(Set.of("logger", "logPersistence"), e.getConfiguredTokens());
        assertTrue(e.getMessage().contains("'logPersistence'"));
        assertTrue(e.getMessage().contains("'db'"));
        assertTrue(e.getMessage().contains("logger"));
        assertTrue(e.getManifestIdMatches().isEmpty());
    }

    @Test
    void load_missingDependencyHintsAtMatchingManifestId() {
        Map<String, AdapterConfig> configs = new LinkedHashMap<>();
        configs.put("db", AdapterConfig.of(named(AdapterManifest.builder("database", "database.document").build())));
        configs.put("service", AdapterConfig.of(named(AdapterManifest.builder("svc", "service").requires("database").build())));

        MissingDependencyException e = assertThrows(MissingDependencyException.class, () -> loader.load(configs));

        assertEquals(List.of("db"), e.getManifestIdMatches());
        assertTrue(e.getMessage().contains("manifest id"));
    }

    @Test
    void load_cycleIsReportedWithBothTokens() {
        Map<String, AdapterConfig> configs = new LinkedHashMap<>();
        configs.put("a", AdapterConfig.of(named(AdapterManifest.builder("a", "a").requires("b").build())));
        configs.put("b", AdapterConfig.of(named(AdapterManifest.builder("b", "b").requires("a").build())));

        CircularDependencyException e = assertThrows(CircularDependencyException.class, () -> loader.load(configs));

        assertTrue(e.getMessage().contains("Circular dependency"));
        assertEquals(Set.of("a", "b"), e.getCycleTokens());
    }

    @Test
    void load_factoryFailureAbortsWithCause() {
        IllegalStateException boom = new IllegalStateException("no connection");
        Map<String, AdapterConfig> configs = Map.of("db",
                AdapterConfig.of(module(AdapterManifest.builder("db", "db").build(), (s, d) -> {
                    throw boom;
                })));

        AdapterInstantiationException e = assertThrows(AdapterInstantiationException.class, () -> loader.load(configs));

        assertEquals("db", e.getToken());
        assertSame(boom, e.getCause());
    }

    @Test
    void load_nullInstanceIsRejected() {
        Map<String, AdapterConfig> configs = Map.of("db", AdapterConfig.of(module(AdapterManifest.builder("db", "db").build(), (s, d) -> null)));

        assertThrows(AdapterInstantiationException.class, () -> loader.load(configs));
    }

    @Test
    void load_passesSettingsToFactory() {
        List<String> seen = new ArrayList<>();
        AdapterModule module = module(AdapterManifest.builder("db", "db").build(), (s, d) -> {
            seen.add(s.getString("url", "none"));
            return new Object();
        });

        loader.load(Map.of("db", AdapterConfig.of(module, AdapterSettings.of(Map.of("url", "mem://test")))));

        assertEquals(List.of("mem://test"), seen);
    }

    @Test
    void load_unknownModuleReferenceFails() {
        assertThrows(AdapterModuleNotFoundException.class, () -> loader.load(Map.of("db", AdapterConfig.of("no-such-module"))));
    }

    @Test
    void load_duplicateAliasIsRejected() {
        Map<String, AdapterConfig> configs = new LinkedHashMap<>();
        configs.put("a", AdapterConfig.of(named(AdapterManifest.builder("a", "a").build())));
        configs.put("b", AdapterConfig.of(named(AdapterManifest.builder("b", "b").build())));
        configs.put("c", AdapterConfig.of(named(AdapterManifest.builder("c", "c").requires("a", "x").requires("b", "x").build())));

        AdapterConfigurationException e = assertThrows(AdapterConfigurationException.class, () -> loader.load(configs));
        assertEquals("c", e.getToken());
    }

    @Test
    void connectExtensions_firesInDescendingPriority() {
        HookTarget target = new HookTarget("onEvent");
        Map<String, AdapterConfig> configs = new LinkedHashMap<>();
        configs.put("low", extension("low", 10));
        configs.put("target", AdapterConfig.of(module(AdapterManifest.builder("t", "target").build(), (s, d) -> target)));
        configs.put("high", extension("high", 100));
        configs.put("mid", extension("mid", 50));

        LoadedAdapters loaded = loader.load(configs);
        List<String> fired = new ArrayList<>();
        target.fire("onEvent", fired);

        assertEquals(List.of("high", "mid", "low"), fired);
        assertEquals(3, loaded.getConnections().size());
        assertEquals("high", loaded.getConnections().get(0).extensionToken());
        assertEquals(3, observer.connected.size());
    }

    @Test
    void connectExtensions_equalPrioritiesFallBackToTokenOrder() {
        HookTarget target = new HookTarget("onEvent");
        Map<String, AdapterConfig> configs = new LinkedHashMap<>();
        configs.put("zeta", extension("zeta", 1));
        configs.put("alpha", extension("alpha", 1));
        configs.put("target", AdapterConfig.of(module(AdapterManifest.builder("t", "target").build(), (s, d) -> target)));

        loader.load(configs);
        List<String> fired = new ArrayList<>();
        target.fire("onEvent", fired);

        assertEquals(List.of("alpha", "zeta"), fired);
    }

    @Test
    void connectExtensions_wiresJsonManifestThatDeclaresExtendsWithoutType() {
        HookTarget target = new HookTarget("onEvent");
        AdapterManifest manifest = AdapterManifest.fromJson(
                "{\"id\":\"ext\",\"implements\":\"ext\","
                        + "\"extends\":{\"adapter\":\"target\",\"hook\":\"onEvent\",\"method\":\"record\",\"priority\":5}}");
        Map<String, AdapterConfig> configs = new LinkedHashMap<>();
        configs.put("target", AdapterConfig.of(module(AdapterManifest.builder("t", "target").build(), (s, d) -> target)));
        configs.put("ext", AdapterConfig.of(module(manifest, (s, d) -> new Recorder("ext", "record"))));

        LoadedAdapters loaded = loader.load(configs);
        List<String> fired = new ArrayList<>();
        target.fire("onEvent", fired);

        assertEquals(List.of("ext"), fired);
        assertEquals(1, loaded.getConnections().size());
        assertEquals(1, observer.connected.size());
    }

    @Test
    void connectExtensions_missingTargetIsSkipped() {
        LoadedAdapters loaded = loader.load(Map.of("ext", extension("ext", 1)));

        assertTrue(loaded.getConnections().isEmpty());
        assertEquals(1, observer.skipped.size());
        assertTrue(observer.skipped.get(0).contains("not configured"));
    }

    @Test
    void connectExtensions_missingHookIsSkipped() {
        Map<String, AdapterConfig> configs = new LinkedHashMap<>();
        configs.put("target", AdapterConfig.of(module(AdapterManifest.builder("t", "target").build(), (s, d) -> new HookTarget("other"))));
        configs.put("ext", extension("ext", 1));

        loader.load(configs);

        assertEquals(1, observer.skipped.size());
        assertTrue(observer.skipped.get(0).contains("no hook 'onEvent'"));
    }

    @Test
    void connectExtensions_missingMethodIsSkipped() {
        Map<String, AdapterConfig> configs = new LinkedHashMap<>();
        configs.put("target", AdapterConfig.of(module(AdapterManifest.builder("t", "target").build(), (s, d) -> new HookTarget("onEvent"))));
        configs.put("ext", AdapterConfig.of(module(
                AdapterManifest.builder("ext", "ext").extendsHook("target", "onEvent", "record", 1).build(),
                (s, d) -> new Recorder("ext", "somethingElse"))));

        loader.load(configs);

        assertEquals(1, observer.skipped.size());
        assertTrue(observer.skipped.get(0).contains("no method 'record'"));
    }

    @Test
    void connectExtensions_failingObserverDoesNotStopLoading() {
        ExtensionWiringObserver failing = new ExtensionWiringObserver() {
            @Override
            public void onConnected(ExtensionConnection connection) {
                throw new IllegalStateException("observer down");
            }

            @Override
            public void onSkipped(String extensionToken, ExtensionPoint point, String reason) {
                throw new IllegalStateException("observer down");
            }
        };
        HookTarget target = new HookTarget("onEvent");
        Map<String, AdapterConfig> configs = new LinkedHashMap<>();
        configs.put("target", AdapterConfig.of(module(AdapterManifest.builder("t", "target").build(), (s, d) -> target)));
        configs.put("ext", extension("ext", 1));
        configs.put("orphan", AdapterConfig.of(module(
                AdapterManifest.builder("orphan", "orphan").extendsHook("missing", "onEvent", "record", 1).build(),
                (s, d) -> new Recorder("orphan", "record"))));

        LoadedAdapters loaded = new AdapterLoader(new MapModuleResolver(), failing).load(configs);

        assertEquals(1, loaded.getConnections().size());
    }

    @Test
    void loadedAdapters_typedLookupChecksType() {
        LoadedAdapters loaded = loader.load(Map.of("db", AdapterConfig.of(named(AdapterManifest.builder("db", "db").build()))));

        assertInstanceOf(Named.class, loaded.get("db"));
        assertThrows(ClassCastException.class, () -> loaded.get("db", Runnable.class));
        assertEquals(List.of("db"), loaded.getShutdownOrder());
    }

    private static AdapterConfig extension(String label, int priority) {
        return AdapterConfig.of(module(
                AdapterManifest.builder(label, label).extendsHook("target", "onEvent", "record", priority).build(),
                (s, d) -> new Recorder(label, "record")));
    }
}
