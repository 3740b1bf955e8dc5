package org.paneltwin.routing.grid;

import lombok.Getter;

import java.util.Objects;

/**
 * Thrown when an occupancy grid cannot be built from the given enclosure and resolution.
 *
 * <p>Fatal to the routing attempt only; the twin's store is never touched.</p>
 */
@Getter
public final class InvalidGridParametersException extends RuntimeException {
    public static final String REASON_RESOLUTION_INVALID = "GRID_RESOLUTION_INVALID";
    public static final String REASON_DIMENSION_INVALID = "GRID_DIMENSION_INVALID";
    public static final String REASON_TOO_MANY_CELLS = "GRID_TOO_MANY_CELLS";

    private final String reasonCode;

    /**
     * Creates a reason-coded grid parameter failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public InvalidGridParametersException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
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
