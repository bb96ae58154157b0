/**
 * Sandbox-side stand-ins for host adapters. Each proxy implements the capability interface and
 * forwards every method over an {@link com.adapterhost.ipc.transport.AdapterTransport}.
 * <ul>
 *   <li>{@code RemoteAdapter} – argument marshalling, response unwrapping, error re-raising</li>
 *   <li>{@code CacheProxy}, {@code DocumentDatabaseProxy}, {@code VectorStoreProxy},
 *   {@code EmbeddingsProxy}, {@code StorageProxy}, {@code LoggerProxy}, {@code LlmProxy},
 *   {@code SqlDatabaseProxy}, {@code ConfigProxy} – one per capability</li>
 *   <li>{@code ProxyAdapters} – the set handed to plugin code</li>
 * </ul>
 */
package com.adapterhost.proxy;
