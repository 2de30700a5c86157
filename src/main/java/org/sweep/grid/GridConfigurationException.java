package org.sweep.grid;

import org.sweep.common.ReasonCodedException;

/**
 * Thrown when raw grid rows cannot be turned into a valid {@link SweepGrid}.
 *
 * <p>Raised before any search starts; reason codes are the {@code REASON_*} constants
 * on {@link SweepGrid}.</p>
 */
public final class GridConfigurationException extends ReasonCodedException {

    public GridConfigurationException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public GridConfigurationException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
