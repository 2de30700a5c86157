package org.sweep.search;

import lombok.extern.slf4j.Slf4j;
import org.sweep.grid.GridCoordinate;
import org.sweep.grid.SweepGrid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Breadth-first minimum-moves search over {@code (row, col, mask)} states.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Grids without collectibles finish immediately with zero moves.</li>
 * <li>The start arrival is seeded with full energy and recorded unconditionally.</li>
 * <li>Entries are dequeued in FIFO order. The first dequeued entry whose mask is full ends
 * the search; its move count is globally minimal because every enqueue adds exactly one move.</li>
 * <li>Successors are enqueued only when {@link DominanceTable#consider(SweepState, int)} accepts them.
 * A state is re-explored only with strictly more energy; a plain visited set would lose
 * routes that pass a recharge cell.</li>
 * <li>A drained frontier ends the search as {@link TraversalPhase#EXHAUSTED}.</li>
 * </ul>
 *
 * <p>All mutable search structures are local to {@link #run(int)}, so one scheduler can be
 * reused and shared across threads.</p>
 */
@Slf4j
public final class TraversalScheduler {
    public static final int UNREACHABLE = -1;

    private final SweepGrid grid;
    private final SearchBudget budget;

    /**
     * Creates a scheduler bound to one grid.
     *
     * @param grid validated grid.
     * @param budget expansion and frontier bounds.
     */
    public TraversalScheduler(SweepGrid grid, SearchBudget budget) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Runs one complete search.
     *
     * @param maxEnergy starting energy and recharge ceiling. A negative value leaves every move
     * unaffordable, so only a grid without collectibles is solved.
     * @return terminal outcome.
     * @throws SearchBudget.BudgetExceededException when a configured bound is crossed.
     */
    public TraversalOutcome run(int maxEnergy) {
        GridCoordinate start = grid.start();
        if (grid.collectibleCount() == 0) {
            return new TraversalOutcome(TraversalPhase.FOUND, 0, 0, 0, 0, List.of(start));
        }

        TransitionFunction transitions = new TransitionFunction(grid, maxEnergy);
        long fullMask = grid.fullMask();
        long initialMask = grid.collectibleIndex(start.row(), start.col()).stream()
                .mapToLong(index -> 1L << index)
                .findFirst()
                .orElse(0L);

        DominanceTable dominance = new DominanceTable(grid.cellCount());
        SweepFrontier frontier = new SweepFrontier();
        PathLabelStore labels = new PathLabelStore();

        SweepState startState = new SweepState(start.row(), start.col(), initialMask);
        int startLabel = labels.add(grid.cellIndex(start.row(), start.col()), PathLabelStore.NO_LABEL);
        dominance.seed(startState, maxEnergy);
        frontier.offer(new FrontierEntry(startState, maxEnergy, 0, startLabel));

        int expandedStates = 0;
        while (!frontier.isEmpty()) {
            FrontierEntry entry = frontier.poll();
            SweepState state = entry.state();
            expandedStates++;
            budget.checkExpansions(expandedStates);
            if (log.isTraceEnabled()) {
                log.trace("[{},{}] mask={}, energy={}, moves={}",
                        state.row(), state.col(), Long.toBinaryString(state.mask()), entry.energy(), entry.moves());
            }

            if (state.collectedAll(fullMask)) {
                return new TraversalOutcome(
                        TraversalPhase.FOUND,
                        entry.moves(),
                        expandedStates,
                        frontier.peakSize(),
                        dominance.size(),
                        toCoordinates(labels.cellPath(entry.labelId()))
                );
            }

            for (StateTransition transition : transitions.successors(state, entry.energy())) {
                SweepState next = transition.state();
                if (!dominance.consider(next, transition.energy())) {
                    continue;
                }
                int label = labels.add(grid.cellIndex(next.row(), next.col()), entry.labelId());
                frontier.offer(new FrontierEntry(next, transition.energy(), entry.moves() + 1, label));
                budget.checkFrontierSize(frontier.size());
            }
        }

        return TraversalOutcome.exhausted(expandedStates, frontier.peakSize(), dominance.size());
    }

    public SweepGrid grid() {
        return grid;
    }

    private List<GridCoordinate> toCoordinates(int[] cellPath) {
        List<GridCoordinate> path = new ArrayList<>(cellPath.length);
        for (int cell : cellPath) {
            path.add(grid.coordinateOf(cell));
        }
        return path;
    }
}
