package org.paneltwin.model.catalog;

import lombok.Getter;

import java.util.Objects;

/**
 * Thrown when a component catalog resource is missing or malformed.
 *
 * <p>Messages are prefixed with the reason code.</p>
 */
@Getter
public final class CatalogLoadException extends RuntimeException {
    public static final String REASON_RESOURCE_MISSING = "CATALOG_RESOURCE_MISSING";
    public static final String REASON_MALFORMED = "CATALOG_MALFORMED";
    public static final String REASON_DUPLICATE_DEFINITION = "CATALOG_DUPLICATE_DEFINITION";

    private final String reasonCode;

    public CatalogLoadException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    public CatalogLoadException(String reasonCode, String message, Throwable cause) {
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
