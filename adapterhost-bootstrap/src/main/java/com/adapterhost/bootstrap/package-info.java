/**
 * Process boundaries of the adapter host:
 * <ul>
 *   <li>{@link com.adapterhost.bootstrap.AdapterHostBootstrap}: host side; load adapters, start the RPC server</li>
 *   <li>{@link com.adapterhost.bootstrap.SandboxBootstrap}: sandbox side; transport plus proxies</li>
 * </ul>
 */
package com.adapterhost.bootstrap;
