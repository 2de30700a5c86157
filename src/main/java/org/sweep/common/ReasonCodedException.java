package org.sweep.common;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Base for contract failures that carry a deterministic reason code.
 *
 * <p>Messages are rendered as {@code [REASON_CODE] message} so logs stay greppable by code.</p>
 */
@Getter
@Accessors(fluent = true)
public abstract class ReasonCodedException extends RuntimeException {
    private final String reasonCode;

    protected ReasonCodedException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    protected ReasonCodedException(String reasonCode, String message, Throwable cause) {
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
