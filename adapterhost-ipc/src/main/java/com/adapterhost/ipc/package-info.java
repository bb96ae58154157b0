/**
 * Adapter RPC between the host and sandboxes: newline-delimited JSON envelopes over a Unix domain socket.
 * <ul>
 *   <li>{@code protocol} – call/response envelopes, frame decoding, protocol version</li>
 *   <li>{@code channel} – selector event loop and framed non-blocking connections</li>
 *   <li>{@code transport} – caller side: pending table, timeouts, circuit breaker, retry classification</li>
 *   <li>{@code bulk} – temp-file side channel for large arguments and results</li>
 *   <li>{@code dispatch} – typed table from (adapter, method) to handlers on host instances</li>
 *   <li>{@code server} – host side: accepts sandboxes and dispatches their calls</li>
 *   <li>{@code metrics} – Micrometer counters and timers for both sides</li>
 * </ul>
 */
package com.adapterhost.ipc;
