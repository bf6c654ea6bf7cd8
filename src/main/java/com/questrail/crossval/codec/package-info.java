/**
 * Validation Record Codec
 * =============================================================================
 *
 * <p>Byte-level mechanics of the one fixed-size record every message kind
 * travels in. The codec sits between the typed messages in
 * {@code com.questrail.crossval.model} and whatever moves bytes:</p>
 *
 * <pre>
 *   byte[788] record
 *        → ValidationRecordCodec   (layout and UTF-8 rules applied here)
 *            → ValidationMessage   (RegisterInstance | SyncPointReport | ...)
 * </pre>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>The codec never sees a partial record. The participant side
 *       accumulates them in {@code RecordChannel}; the coordinator side frames
 *       them in its Netty pipeline.</li>
 *   <li>A malformed record raises {@link com.questrail.crossval.codec.WireDecodeException};
 *       deciding what that means for the connection is the caller's job.</li>
 * </ul>
 */
package com.questrail.crossval.codec;
