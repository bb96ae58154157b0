/**
 * Adapter loading. Given a configuration set (token → module reference + settings) the
 * {@link com.adapterhost.loader.AdapterLoader} builds a dependency graph from the modules' manifests,
 * orders it topologically, instantiates every adapter with its dependency bundle and finally wires
 * extensions onto their target hooks.
 * <ul>
 *   <li>{@link com.adapterhost.loader.AdapterModule} – SPI: manifest + factory, discovered via ServiceLoader</li>
 *   <li>{@link com.adapterhost.loader.AdapterModuleResolver} – module reference → module</li>
 *   <li>{@link com.adapterhost.loader.graph.DependencyGraph} – nodes, edges (dependency → dependent), Kahn sort</li>
 *   <li>{@link com.adapterhost.loader.AdapterDependencies} – alias → instance bundle handed to factories</li>
 *   <li>{@link com.adapterhost.loader.ExtensionWiringObserver} – reports connected and skipped extensions</li>
 * </ul>
 */
package com.adapterhost.loader;
