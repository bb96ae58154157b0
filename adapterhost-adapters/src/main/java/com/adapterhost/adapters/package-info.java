/**
 * Adapter capability contracts. An adapter is an instance satisfying one capability; the host loads
 * adapters by token and sandboxes reach them through proxies with the same interfaces.
 * <ul>
 *   <li>{@link com.adapterhost.adapters.cache.Cache}, {@link com.adapterhost.adapters.db.DocumentDatabase},
 *       {@link com.adapterhost.adapters.vector.VectorStore}, {@link com.adapterhost.adapters.embeddings.Embeddings},
 *       {@link com.adapterhost.adapters.storage.Storage}, {@link com.adapterhost.adapters.logging.AdapterLogger},
 *       {@link com.adapterhost.adapters.llm.Llm}, {@link com.adapterhost.adapters.sql.SqlDatabase},
 *       {@link com.adapterhost.adapters.config.ConfigProvider}</li>
 *   <li>{@link com.adapterhost.adapters.extension.Hookable} / {@link com.adapterhost.adapters.extension.ExtensionAdapter} – hook wiring</li>
 *   <li>{@link com.adapterhost.adapters.manifest.AdapterManifest} – static adapter description</li>
 *   <li>{@link com.adapterhost.adapters.ResourceCleanup} – onExit() for shutdown</li>
 * </ul>
 */
package com.adapterhost.adapters;
