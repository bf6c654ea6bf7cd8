package com.questrail.crossval.model;

/**
 * Canonical semantic representation of a validation protocol message.
 *
 * <h2>Purpose</h2>
 * <p>
 * A {@code ValidationMessage} is a fully decoded record. The coordinator and
 * the participant client reason only about this form; byte offsets, NUL
 * padding and kind codes are resolved by the codec before an instance exists.
 * </p>
 *
 * <p>
 * The hierarchy is sealed so that dispatch on message kind is an exhaustive
 * {@code switch} rather than a cast on a raw buffer.
 * </p>
 *
 * <h2>Directionality</h2>
 * <ul>
 *   <li>Participant → Coordinator: {@link RegisterInstance}, {@link SyncPointReport}, {@link Shutdown}</li>
 *   <li>Coordinator → Participant: {@link ValidationResult}</li>
 * </ul>
 */
public sealed interface ValidationMessage
        permits RegisterInstance, SyncPointReport, ValidationResult, Shutdown {

    /**
     * @return the wire kind of this message
     */
    MessageKind kind();
}
