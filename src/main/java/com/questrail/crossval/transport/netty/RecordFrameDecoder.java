package com.questrail.crossval.transport.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * RecordFrameDecoder
 * =============================================================================
 * Frames an inbound TCP byte stream into fixed-size records.
 *
 * <p>Each complete record is copied into a {@code byte[]} and passed on; the
 * inbound {@link ByteBuf} never leaves the pipeline. Interpreting the record is
 * left to the coordinator.</p>
 *
 * <p>If the stream ends with a partial record buffered, a {@link TruncatedRecord}
 * marker is emitted ahead of {@code channelInactive} so the endpoint can report
 * the close as a protocol violation.</p>
 */
final class RecordFrameDecoder extends ByteToMessageDecoder
{
    private final int recordSize;

    RecordFrameDecoder(int recordSize) {
        if (recordSize <= 0) {
            throw new IllegalArgumentException("recordSize must be positive");
        }
        this.recordSize = recordSize;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        while (in.readableBytes() >= recordSize) {
            byte[] record = new byte[recordSize];
            in.readBytes(record);
            out.add(record);
        }
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        decode(ctx, in, out);
        int leftover = in.readableBytes();
        if (leftover > 0) {
            in.skipBytes(leftover);
            out.add(new TruncatedRecord(leftover));
        }
    }
}
