package org.sweep.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.sweep.grid.SweepGrid;
import org.sweep.search.SearchBudget;
import org.sweep.testutil.SweepFixtures;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SweepPlanner Property Tests")
class SweepPlannerPropertyTest {
    private static final int GRID_COUNT = 400;
    private static final int MAX_ENERGY = 8;

    private final SweepPlanner planner = SweepPlanner.builder()
            .searchBudget(SearchBudget.unbounded())
            .build();

    @Test
    @DisplayName("Results match an exhaustive (cell, mask, energy) search")
    void testMatchesExhaustiveSearch() {
        Random random = new Random(7L);
        for (int i = 0; i < GRID_COUNT; i++) {
            List<String> rows = SweepFixtures.randomGrid(random, 5, 5);
            int energy = random.nextInt(MAX_ENERGY + 1);
            assertEquals(
                    SweepFixtures.exhaustiveMinMoves(rows, energy),
                    planner.solve(rows, energy),
                    () -> rows + " @ energy " + energy
            );
        }
    }

    @Test
    @DisplayName("Results are -1 or within the state space bound, and paths replay")
    void testBoundsAndPaths() {
        Random random = new Random(11L);
        for (int i = 0; i < GRID_COUNT; i++) {
            List<String> rows = SweepFixtures.randomGrid(random, 4, 6);
            int energy = random.nextInt(MAX_ENERGY + 1);
            MovesResult result = planner.plan(SweepRequest.builder().rows(rows).maxEnergy(energy).build());
            SweepGrid grid = SweepGrid.parse(rows);

            int moves = result.getMoves();
            assertTrue(moves == MovesResult.UNREACHABLE || moves >= 0);
            assertTrue((long) moves <= ((long) grid.cellCount() << grid.collectibleCount()));
            if (result.isReachable()) {
                SweepFixtures.assertValidSweep(rows, energy, moves, result.getPath());
            }
        }
    }

    @Test
    @DisplayName("More energy never makes the answer worse")
    void testEnergyMonotonicity() {
        Random random = new Random(23L);
        for (int i = 0; i < GRID_COUNT / 4; i++) {
            List<String> rows = SweepFixtures.randomGrid(random, 4, 5);
            int previous = MovesResult.UNREACHABLE;
            for (int energy = 0; energy <= MAX_ENERGY; energy++) {
                int moves = planner.solve(rows, energy);
                if (previous != MovesResult.UNREACHABLE) {
                    assertTrue(moves != MovesResult.UNREACHABLE, rows + " lost reachability at energy " + energy);
                    assertTrue(moves <= previous, rows + " got worse at energy " + energy);
                }
                previous = moves;
            }
        }
    }

    @Test
    @DisplayName("Repeated calls return identical results")
    void testIdempotence() {
        Random random = new Random(31L);
        for (int i = 0; i < GRID_COUNT / 4; i++) {
            List<String> rows = SweepFixtures.randomGrid(random, 5, 5);
            int energy = random.nextInt(MAX_ENERGY + 1);
            MovesResult first = planner.plan(SweepRequest.builder().rows(rows).maxEnergy(energy).build());
            MovesResult second = planner.plan(SweepRequest.builder().rows(rows).maxEnergy(energy).build());
            assertEquals(first, second);
        }
    }
}
