package com.questrail.crossval.model;

/**
 * Wire discriminator for {@link ValidationMessage}.
 *
 * <p>Codes are part of the record layout; all participants of a run must
 * agree on them. New kinds are appended with new codes.</p>
 */
public enum MessageKind {
    REGISTER_INSTANCE(1),
    SYNC_POINT(2),
    VALIDATION_RESULT(3),
    SHUTDOWN(4);

    private final int code;

    MessageKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @throws IllegalArgumentException if {@code code} names no kind
     */
    public static MessageKind fromCode(int code) {
        for (MessageKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown message kind code: " + code);
    }
}
