package org.sweep.core;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Client-facing planning request.
 */
@Value
@Builder
public class SweepRequest {
    /** Grid rows using {@code S . X R L} symbols. */
    List<String> rows;
    /** Starting energy, also restored by recharge cells. */
    int maxEnergy;
}
