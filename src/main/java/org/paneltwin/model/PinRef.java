package org.paneltwin.model;

/**
 * Store-wide pin address: owning instance plus the pin name from its definition.
 *
 * <p>Textual form is {@code <instanceId>:<pinName>}.</p>
 */
public record PinRef(String instanceId, String pinName) {
    private static final char SEPARATOR = ':';

    public PinRef {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId must be non-blank");
        }
        if (pinName == null || pinName.isBlank()) {
            throw new IllegalArgumentException("pinName must be non-blank");
        }
    }

    public static PinRef of(String instanceId, String pinName) {
        return new PinRef(instanceId, pinName);
    }

    /**
     * Parses {@code <instanceId>:<pinName>}. The split happens at the first separator, so
     * pin names may themselves contain {@code ':'}.
     */
    public static PinRef parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("pin reference must be non-null");
        }
        int split = text.indexOf(SEPARATOR);
        if (split <= 0 || split == text.length() - 1) {
            throw new IllegalArgumentException("pin reference must look like <instanceId>:<pinName>, got '" + text + "'");
        }
        return new PinRef(text.substring(0, split), text.substring(split + 1));
    }

    @Override
    public String toString() {
        return instanceId + SEPARATOR + pinName;
    }
}
