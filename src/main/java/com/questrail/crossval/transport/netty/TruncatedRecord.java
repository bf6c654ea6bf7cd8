package com.questrail.crossval.transport.netty;

/**
 * Marker emitted by {@link RecordFrameDecoder} when the inbound side closes
 * with part of a record still buffered.
 */
record TruncatedRecord(int bufferedBytes) {
}
