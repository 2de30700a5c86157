package org.sweep.core;

import java.util.List;

/**
 * Public minimum-moves planning contract.
 *
 * <p>Implementations are expected to perform deterministic input validation and
 * throw reason-coded runtime exceptions for contract failures.</p>
 */
public interface SweepService {
    /**
     * Plans one full collection sweep.
     *
     * @param request grid rows and energy ceiling.
     * @return move count, path, and search telemetry.
     */
    MovesResult plan(SweepRequest request);

    /**
     * Returns the minimal move count to gather every collectible, or {@link MovesResult#UNREACHABLE}.
     *
     * @param rows ordered, equal-length rows of terrain symbols.
     * @param maxEnergy starting energy and recharge ceiling.
     * @return minimal move count ({@code >= 0}) or {@code -1}.
     */
    int solve(List<String> rows, int maxEnergy);
}
