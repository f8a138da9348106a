package org.mazebreak.routing.search;

import org.mazebreak.core.grid.Direction;
import org.mazebreak.core.grid.Grid;
import org.mazebreak.core.grid.Position;
import org.mazebreak.routing.testutil.MazeFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Frontier Engine Tests")
class FrontierEngineTest {

    @Nested
    @DisplayName("1. Distance Contracts")
    class DistanceContractTests {

        @Test
        @DisplayName("Origin maps to step 1")
        void testOriginIsStepOne() {
            Grid grid = Grid.of(MazeFixtures.middleColumnWall());
            FrontierEngine engine = new FrontierEngine(grid);
            for (int cell = 0; cell < grid.cellCount(); cell++) {
                Position origin = grid.positionOf(cell);
                assertEquals(OptionalInt.of(1), engine.distancesFrom(origin).stepsAt(origin), "origin " + origin);
            }
        }

        @Test
        @DisplayName("Hand-walked distances on the 3x3 maze")
        void testKnownDistances() {
            Grid grid = Grid.of(MazeFixtures.middleColumnWall());
            DistanceMap fromStart = new FrontierEngine(grid).distancesFrom(grid.topLeft());

            assertEquals(7, fromStart.size());
            assertEquals(7, fromStart.maxSteps());
            assertEquals(OptionalInt.of(2), fromStart.stepsAt(new Position(1, 0)));
            assertEquals(OptionalInt.of(5), fromStart.stepsAt(new Position(2, 2)));
            assertEquals(OptionalInt.of(7), fromStart.stepsAt(new Position(0, 2)));
            assertFalse(fromStart.contains(new Position(0, 1)), "Walls are never reached");
            assertFalse(fromStart.contains(new Position(1, 1)), "Walls are never reached");
        }

        @Test
        @DisplayName("Unreachable floor tiles are absent, not infinite")
        void testUnreachableAbsent() {
            Grid grid = Grid.of(MazeFixtures.doubleWallBand());
            DistanceMap fromStart = new FrontierEngine(grid).distancesFrom(grid.topLeft());

            assertEquals(2, fromStart.size());
            assertEquals(OptionalInt.empty(), fromStart.stepsAt(new Position(0, 3)));
            assertEquals(OptionalInt.empty(), fromStart.stepsAt(new Position(9, 9)));
            assertEquals(DistanceMap.UNREACHED, fromStart.stepsAtCell(3));
        }

        @Test
        @DisplayName("Wall origin still expands into floor neighbours")
        void testWallOrigin() {
            Grid grid = Grid.of(new int[][]{
                    {1, 0},
                    {0, 0}
            });
            DistanceMap map = new FrontierEngine(grid).distancesFrom(grid.topLeft());

            assertEquals(OptionalInt.of(1), map.stepsAt(new Position(0, 0)));
            assertEquals(OptionalInt.of(2), map.stepsAt(new Position(0, 1)));
            assertEquals(OptionalInt.of(2), map.stepsAt(new Position(1, 0)));
            assertEquals(OptionalInt.of(3), map.stepsAt(new Position(1, 1)));
        }

        @Test
        @DisplayName("Out-of-bounds origin is rejected")
        void testOriginOutOfBounds() {
            FrontierEngine engine = new FrontierEngine(Grid.of(MazeFixtures.open(2, 2)));
            assertThrows(IllegalArgumentException.class, () -> engine.distancesFrom(new Position(2, 0)));
            assertThrows(NullPointerException.class, () -> engine.distancesFrom(null));
        }

        @Test
        @DisplayName("Single tile grid")
        void testSingleTile() {
            Grid grid = Grid.of(new int[][]{{0}});
            DistanceMap map = new FrontierEngine(grid).distancesFrom(grid.topLeft());
            assertEquals(1, map.size());
            assertEquals(1, map.maxSteps());
        }
    }

    @Nested
    @DisplayName("2. BFS Properties on Random Mazes")
    class PropertyTests {

        @Test
        @DisplayName("Adjacent reached tiles differ by exactly one step")
        void testMonotonicity() {
            Random random = new Random(42L);
            for (int trial = 0; trial < 50; trial++) {
                Grid grid = Grid.of(MazeFixtures.random(random, 3 + random.nextInt(10), 3 + random.nextInt(10), 0.3));
                DistanceMap map = new FrontierEngine(grid).distancesFrom(grid.topLeft());

                map.forEachCell((cell, steps) -> {
                    if (!grid.isFloorCell(cell)) {
                        return;
                    }
                    for (Direction direction : Direction.ordered()) {
                        int neighbor = grid.neighborIndex(cell, direction);
                        if (neighbor == Grid.NO_CELL || !grid.isFloorCell(neighbor)) {
                            continue;
                        }
                        int neighborSteps = map.stepsAtCell(neighbor);
                        assertTrue(neighborSteps != DistanceMap.UNREACHED,
                                "Floor neighbour of a reached floor tile must be reached");
                        assertEquals(1, Math.abs(steps - neighborSteps),
                                "BFS levels must differ by one across a move");
                    }
                });
            }
        }

        @Test
        @DisplayName("Step counts match an independent BFS plus one")
        void testMatchesReferenceBfs() {
            Random random = new Random(7L);
            for (int trial = 0; trial < 30; trial++) {
                int[][] maze = MazeFixtures.random(random, 2 + random.nextInt(8), 2 + random.nextInt(8), 0.35);
                Grid grid = Grid.of(maze);
                DistanceMap map = new FrontierEngine(grid).distancesFrom(grid.topLeft());

                for (int cell = 0; cell < grid.cellCount(); cell++) {
                    Position target = grid.positionOf(cell);
                    if (!grid.isFloor(target)) {
                        continue;
                    }
                    int moves = MazeFixtures.moves(maze, 0, 0, target.row(), target.col());
                    OptionalInt steps = map.stepsAt(target);
                    if (moves < 0) {
                        assertTrue(steps.isEmpty(), "unreachable " + target);
                    } else {
                        assertEquals(OptionalInt.of(moves + 1), steps, "target " + target);
                    }
                }
            }
        }
    }

    @Nested
    @DisplayName("3. VisitedSet")
    class VisitedSetTests {

        @Test
        @DisplayName("First mark wins, later marks are rejected")
        void testMarkAndCheck() {
            VisitedSet visited = new VisitedSet(130);
            assertFalse(visited.isVisited(129));
            assertTrue(visited.markVisited(129));
            assertTrue(visited.isVisited(129));
            assertFalse(visited.markVisited(129));
            assertTrue(visited.markVisited(64));
            assertEquals(2, visited.count());
        }

        @Test
        @DisplayName("Count tracks distinct cells across the whole capacity")
        void testCountDistinct() {
            VisitedSet visited = new VisitedSet(200);
            for (int i = 0; i < 200; i += 3) {
                visited.markVisited(i);
                visited.markVisited(i);
            }
            assertEquals(67, visited.count());
            assertTrue(visited.isVisited(198));
            assertFalse(visited.isVisited(199));
        }

        @Test
        @DisplayName("Bounds are enforced")
        void testBounds() {
            VisitedSet visited = new VisitedSet(10);
            assertThrows(IllegalArgumentException.class, () -> visited.markVisited(10));
            assertThrows(IllegalArgumentException.class, () -> visited.isVisited(-1));
            assertThrows(IllegalArgumentException.class, () -> new VisitedSet(0));
        }
    }
}
