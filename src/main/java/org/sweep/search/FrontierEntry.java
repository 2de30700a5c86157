package org.sweep.search;

/**
 * Queued arrival awaiting expansion.
 *
 * @param state position and collection mask.
 * @param energy energy held at this arrival.
 * @param moves moves taken from the start.
 * @param labelId path label used to rebuild the route on success.
 */
public record FrontierEntry(SweepState state, int energy, int moves, int labelId) {
}
