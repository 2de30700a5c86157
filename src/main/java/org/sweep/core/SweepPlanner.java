package org.sweep.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.sweep.grid.GridConfigurationException;
import org.sweep.grid.SweepGrid;
import org.sweep.search.SearchBudget;
import org.sweep.search.TraversalOutcome;
import org.sweep.search.TraversalScheduler;

import java.util.List;

/**
 * Main planning entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate the request envelope. Any energy ceiling is accepted; a negative one makes every
 * move unaffordable, so only grids without collectibles are solved.</li>
 * <li>Parse rows into a {@link SweepGrid}; structural failures surface as
 * {@link GridConfigurationException} before any search starts.</li>
 * <li>Run one {@link TraversalScheduler} search with the configured {@link SearchBudget}.</li>
 * <li>Wrap budget guardrail exceptions into {@link SweepPlannerException} with a stable reason code.</li>
 * </ul>
 *
 * <p>The planner holds no per-call state; concurrent calls are independent.</p>
 */
@Slf4j
public final class SweepPlanner implements SweepService {
    public static final String REASON_REQUEST_REQUIRED = "SWEEP_REQUEST_REQUIRED";
    public static final String REASON_SEARCH_BUDGET_EXCEEDED = "SWEEP_SEARCH_BUDGET_EXCEEDED";

    private final SearchBudget searchBudget;

    /**
     * Creates a planner with budget bounds read from system properties.
     */
    public SweepPlanner() {
        this(null);
    }

    /**
     * Creates a planner.
     *
     * @param searchBudget optional search bounds; {@link SearchBudget#defaults()} when absent.
     */
    @Builder
    public SweepPlanner(SearchBudget searchBudget) {
        this.searchBudget = searchBudget == null ? SearchBudget.defaults() : searchBudget;
    }

    /**
     * Plans one request.
     *
     * @throws SweepPlannerException when the request is missing or the search budget is exceeded.
     * @throws GridConfigurationException when the grid rows are malformed.
     */
    @Override
    public MovesResult plan(SweepRequest request) {
        if (request == null) {
            throw new SweepPlannerException(REASON_REQUEST_REQUIRED, "sweep request must be non-null");
        }
        int maxEnergy = request.getMaxEnergy();

        SweepGrid grid = SweepGrid.parse(request.getRows());
        log.debug("planning sweep over {}x{} grid with {} collectibles, maxEnergy={}",
                grid.rowCount(), grid.columnCount(), grid.collectibleCount(), maxEnergy);

        TraversalOutcome outcome;
        try {
            outcome = new TraversalScheduler(grid, searchBudget).run(maxEnergy);
        } catch (SearchBudget.BudgetExceededException ex) {
            log.warn("sweep search aborted: {}", ex.getMessage());
            throw new SweepPlannerException(
                    REASON_SEARCH_BUDGET_EXCEEDED,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        }

        log.debug("sweep finished: phase={}, moves={}, expandedStates={}",
                outcome.phase(), outcome.moves(), outcome.expandedStates());

        return MovesResult.builder()
                .moves(outcome.moves())
                .phase(outcome.phase())
                .collectibleCount(grid.collectibleCount())
                .expandedStates(outcome.expandedStates())
                .peakFrontierSize(outcome.peakFrontierSize())
                .dominanceEntries(outcome.dominanceEntries())
                .path(outcome.path())
                .build();
    }

    @Override
    public int solve(List<String> rows, int maxEnergy) {
        return plan(SweepRequest.builder()
                .rows(rows)
                .maxEnergy(maxEnergy)
                .build()).getMoves();
    }
}
