/**
 * Built-in adapter modules:
 * <ul>
 *   <li>{@code memory-cache}: process-local cache with TTL</li>
 *   <li>{@code memory-document-db}: document collections with Mongo-style filters</li>
 *   <li>{@code memory-vector-store}: cosine-similarity vector search</li>
 *   <li>{@code hashing-embeddings}: deterministic feature-hashing embeddings</li>
 *   <li>{@code local-storage}: blob storage under a base directory</li>
 *   <li>{@code slf4j-logger}: structured logger with the {@code onLog} hook</li>
 *   <li>{@code log-ring-buffer} and {@code log-persistence}: extensions on {@code logger.onLog}</li>
 *   <li>{@code echo-llm}: deterministic completion model</li>
 *   <li>{@code jdbc-sql}: SQL and transactions through a JDBC driver</li>
 *   <li>{@code json-config}: platform configuration with profiles</li>
 * </ul>
 * Registered through {@link java.util.ServiceLoader} and aggregated by {@link com.adapterhost.internal.adapters.InternalAdapters}.
 */
package com.adapterhost.internal.adapters;
