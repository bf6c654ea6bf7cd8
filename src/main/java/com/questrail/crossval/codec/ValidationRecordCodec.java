package com.questrail.crossval.codec;

import com.questrail.crossval.api.Fingerprint;
import com.questrail.crossval.model.MessageKind;
import com.questrail.crossval.model.RegisterInstance;
import com.questrail.crossval.model.Shutdown;
import com.questrail.crossval.model.SyncPointReport;
import com.questrail.crossval.model.ValidationMessage;
import com.questrail.crossval.model.ValidationResult;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * ValidationRecordCodec
 * =============================================================================
 * Encodes and decodes the fixed-layout binary record shared by all message kinds.
 *
 * <h2>Layout (big-endian, {@value #RECORD_SIZE} bytes)</h2>
 * <pre>
 *   offset  size  field
 *   ------  ----  -----------------------------------------------
 *        0     4  kind code                 ({@link MessageKind#code()})
 *        4     4  instance id               (-1 for coordinator results)
 *        8     4  sync point sequence       (0 when not applicable)
 *       12     4  point ordinal             (-1 when not applicable)
 *       16     4  passed flag               (0 / 1)
 *       20   256  fingerprint               (UTF-8, NUL padded)
 *      276   512  detail / peer fingerprint (UTF-8, NUL padded)
 * </pre>
 *
 * <p>There is no version field: every participant of a run must be built
 * against the same layout.</p>
 *
 * <p>The codec is stateless and only ever sees complete records. Accumulating
 * partial reads is the job of the I/O layer ({@code RecordChannel}) or of the
 * Netty frame decoder.</p>
 */
public final class ValidationRecordCodec
{
    public static final int FINGERPRINT_FIELD_SIZE = 256;
    public static final int DETAIL_FIELD_SIZE = 512;

    static final int KIND_OFFSET = 0;
    static final int INSTANCE_OFFSET = 4;
    static final int SYNC_POINT_OFFSET = 8;
    static final int ORDINAL_OFFSET = 12;
    static final int PASSED_OFFSET = 16;
    static final int FINGERPRINT_OFFSET = 20;
    static final int DETAIL_OFFSET = FINGERPRINT_OFFSET + FINGERPRINT_FIELD_SIZE;

    public static final int RECORD_SIZE = DETAIL_OFFSET + DETAIL_FIELD_SIZE;

    /**
     * Instance id carried by records that originate at the coordinator.
     */
    public static final int FROM_COORDINATOR = -1;

    private static final int NO_ORDINAL = -1;

    /**
     * Encodes {@code message} into a new {@value #RECORD_SIZE}-byte array.
     */
    public byte[] encode(ValidationMessage message) {
        Objects.requireNonNull(message, "message");

        ByteBuffer buf = ByteBuffer.allocate(RECORD_SIZE);
        buf.putInt(KIND_OFFSET, message.kind().code());

        if (message instanceof RegisterInstance m) {
            header(buf, m.instanceId(), 0, NO_ORDINAL, false);
        }
        else if (message instanceof SyncPointReport m) {
            header(buf, m.instanceId(), m.syncPoint(), m.pointOrdinal(), false);
            putText(buf, FINGERPRINT_OFFSET, FINGERPRINT_FIELD_SIZE, m.fingerprint().text());
        }
        else if (message instanceof ValidationResult m) {
            header(buf, FROM_COORDINATOR, m.syncPoint(), NO_ORDINAL, m.passed());
            putText(buf, DETAIL_OFFSET, DETAIL_FIELD_SIZE, m.peerFingerprint().text());
        }
        else if (message instanceof Shutdown m) {
            header(buf, m.instanceId(), 0, NO_ORDINAL, false);
        }
        return buf.array();
    }

    /**
     * Decodes one complete record.
     *
     * @param record exactly {@value #RECORD_SIZE} bytes
     * @throws WireDecodeException if the record is malformed
     */
    public ValidationMessage decode(byte[] record) {
        Objects.requireNonNull(record, "record");
        if (record.length != RECORD_SIZE) {
            throw new WireDecodeException(
                    "Record must be " + RECORD_SIZE + " bytes (was " + record.length + ")");
        }

        ByteBuffer buf = ByteBuffer.wrap(record);

        final MessageKind kind;
        try {
            kind = MessageKind.fromCode(buf.getInt(KIND_OFFSET));
        } catch (IllegalArgumentException e) {
            throw new WireDecodeException(e.getMessage(), e);
        }

        int instanceId = buf.getInt(INSTANCE_OFFSET);
        int syncPoint = buf.getInt(SYNC_POINT_OFFSET);

        return switch (kind) {
            case REGISTER_INSTANCE -> new RegisterInstance(instanceId);
            case SYNC_POINT -> new SyncPointReport(
                    instanceId,
                    syncPoint,
                    buf.getInt(ORDINAL_OFFSET),
                    fingerprint(getText(record, FINGERPRINT_OFFSET, FINGERPRINT_FIELD_SIZE)));
            case VALIDATION_RESULT -> new ValidationResult(
                    syncPoint,
                    buf.getInt(PASSED_OFFSET) != 0,
                    fingerprint(getText(record, DETAIL_OFFSET, DETAIL_FIELD_SIZE)));
            case SHUTDOWN -> new Shutdown(instanceId);
        };
    }

    private static void header(ByteBuffer buf, int instanceId, int syncPoint, int ordinal, boolean passed) {
        buf.putInt(INSTANCE_OFFSET, instanceId);
        buf.putInt(SYNC_POINT_OFFSET, syncPoint);
        buf.putInt(ORDINAL_OFFSET, ordinal);
        buf.putInt(PASSED_OFFSET, passed ? 1 : 0);
    }

    private static void putText(ByteBuffer buf, int offset, int fieldSize, String text) {
        byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
        if (utf8.length > fieldSize - 1) {
            // Fingerprint already bounds its text; this guards the layout itself.
            throw new IllegalArgumentException(
                    "Text of " + utf8.length + " bytes does not fit a " + fieldSize + "-byte field");
        }
        buf.put(offset, utf8);
    }

    private static String getText(byte[] record, int offset, int fieldSize) {
        int end = offset;
        int limit = offset + fieldSize;
        while (end < limit && record[end] != 0) {
            end++;
        }
        if (end == limit) {
            throw new WireDecodeException("Text field at offset " + offset + " is not NUL terminated");
        }
        try {
            CharBuffer chars = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(record, offset, end - offset));
            return chars.toString();
        } catch (CharacterCodingException e) {
            throw new WireDecodeException("Text field at offset " + offset + " is not valid UTF-8", e);
        }
    }

    private static Fingerprint fingerprint(String text) {
        // The detail field is wider than a fingerprint; Fingerprint.of truncates.
        return Fingerprint.of(text);
    }
}
