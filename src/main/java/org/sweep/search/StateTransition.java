package org.sweep.search;

/**
 * One candidate successor produced by {@link TransitionFunction}.
 *
 * @param direction move that produced this candidate.
 * @param state destination state, mask updated on arrival.
 * @param energy energy after arrival (post decrement, post recharge).
 */
public record StateTransition(Direction direction, SweepState state, int energy) {
}
