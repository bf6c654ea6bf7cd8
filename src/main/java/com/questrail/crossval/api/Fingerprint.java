package com.questrail.crossval.api;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Fingerprint
 * -----------------------------------------------------------------------------
 * A bounded, formatted snapshot of program state at an instrumented point.
 *
 * <p>Conventionally a sequence of {@code label=value} tokens separated by
 * whitespace, e.g. {@code "step=3 pot=-12.4310000001 kin=8.5"}. The protocol
 * treats the text as opaque except for comparison.</p>
 *
 * <h2>Bound</h2>
 * The encoded form never exceeds {@link #MAX_BYTES} UTF-8 bytes, which leaves
 * room for the NUL terminator of the 256-byte wire field. Longer input is
 * truncated at a character boundary, the way a bounded {@code printf} would.
 */
public final class Fingerprint
{
    /**
     * Maximum encoded length in UTF-8 bytes.
     */
    public static final int MAX_BYTES = 255;

    private static final Fingerprint EMPTY = new Fingerprint("");

    private final String text;

    private Fingerprint(String text) {
        this.text = text;
    }

    /**
     * Creates a fingerprint from already formatted text, truncating if needed.
     *
     * @param text formatted state snapshot (must not contain NUL)
     */
    public static Fingerprint of(String text) {
        Objects.requireNonNull(text, "text");
        if (text.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("fingerprint must not contain NUL characters");
        }
        if (text.isEmpty()) {
            return EMPTY;
        }
        return new Fingerprint(truncate(text));
    }

    /**
     * Formats a fingerprint with {@link Locale#ROOT} so that every participant
     * renders numbers identically regardless of host locale.
     */
    public static Fingerprint format(String format, Object... args) {
        Objects.requireNonNull(format, "format");
        return of(String.format(Locale.ROOT, format, args));
    }

    public static Fingerprint empty() {
        return EMPTY;
    }

    public String text() {
        return text;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    private static String truncate(String text) {
        byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
        if (utf8.length <= MAX_BYTES) {
            return text;
        }
        int bytes = 0;
        int end = 0;
        while (end < text.length()) {
            int cp = text.codePointAt(end);
            int width = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + width > MAX_BYTES) {
                break;
            }
            bytes += width;
            end += Character.charCount(cp);
        }
        return text.substring(0, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fingerprint that)) return false;
        return text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
