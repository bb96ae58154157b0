/**
 * Wire codec shared by the host and the sandbox. Values crossing the process boundary are turned into
 * JSON trees ({@link com.fasterxml.jackson.databind.JsonNode}) and back.
 * <ul>
 *   <li>{@link com.adapterhost.codec.WireCodec} – serialize / deserialize, generic and typed</li>
 *   <li>{@link com.adapterhost.codec.WireTypes} – the {@code __type} tags for Buffer, Date, Error and bulk references</li>
 *   <li>{@link com.adapterhost.codec.RemoteAdapterException} – an adapter error rebuilt on the calling side</li>
 *   <li>{@link com.adapterhost.codec.CodedError} – machine-readable error code carried across the wire</li>
 * </ul>
 */
package com.adapterhost.codec;
