package org.sweep.core;

import org.sweep.common.ReasonCodedException;

/**
 * Planner contract failure; reason codes are the {@code REASON_*} constants on {@link SweepPlanner}.
 */
public final class SweepPlannerException extends ReasonCodedException {

    public SweepPlannerException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public SweepPlannerException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
