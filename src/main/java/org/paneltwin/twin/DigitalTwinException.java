package org.paneltwin.twin;

import lombok.Getter;

import java.util.Objects;

/**
 * Caller-contract violation on a {@link DigitalTwin} operation, with a deterministic reason code.
 *
 * <p>Always raised before the twin is mutated, so the store is unchanged when it propagates.</p>
 */
@Getter
public final class DigitalTwinException extends RuntimeException {
    public static final String REASON_UNKNOWN_PIN = "TWIN_UNKNOWN_PIN";
    public static final String REASON_UNKNOWN_COMPONENT = "TWIN_UNKNOWN_COMPONENT";
    public static final String REASON_UNKNOWN_CONNECTION = "TWIN_UNKNOWN_CONNECTION";
    public static final String REASON_UNKNOWN_DEFINITION = "TWIN_UNKNOWN_DEFINITION";
    public static final String REASON_INVALID_SNAPSHOT = "TWIN_INVALID_SNAPSHOT";
    public static final String REASON_INVALID_ARGUMENT = "TWIN_INVALID_ARGUMENT";

    private final String reasonCode;

    /**
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public DigitalTwinException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public DigitalTwinException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
