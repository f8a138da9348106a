package org.mazebreak.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Base for every failure the solver surfaces to callers.
 *
 * <p>The reason code is a stable identifier for programmatic handling and is also
 * prepended to the message as {@code [CODE] ...}.</p>
 */
@Getter
public abstract class ReasonCodedException extends RuntimeException {
    private final String reasonCode;

    protected ReasonCodedException(String reasonCode, String message) {
        this(reasonCode, message, null);
    }

    protected ReasonCodedException(String reasonCode, String message, Throwable cause) {
        super(prefixed(checkedCode(reasonCode), message), cause);
        this.reasonCode = reasonCode;
    }

    private static String prefixed(String code, String message) {
        return "[" + code + "] " + Objects.requireNonNull(message, "message");
    }

    private static String checkedCode(String reasonCode) {
        if (Objects.requireNonNull(reasonCode, "reasonCode").isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return reasonCode;
    }
}
