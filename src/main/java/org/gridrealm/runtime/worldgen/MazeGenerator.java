package org.gridrealm.runtime.worldgen;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.gridrealm.runtime.Config;
import org.gridrealm.runtime.model.Cell;
import org.gridrealm.runtime.model.Grid;
import org.gridrealm.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Carves a perfect maze into a grid using randomized depth-first backtracking.
 * <p>
 * Carved cells sit on odd coordinates and are two cells apart, so a wall cell always separates
 * two passages and the outer border is never touched. The walk starts from a single cell, keeps
 * a backtrack stack, and stops when the stack is empty. Cells the walk never reaches stay walls.
 * <p>
 * Neighbour order is part of the seeded contract: the candidates UP, DOWN, LEFT, RIGHT are
 * shuffled with a Fisher-Yates pass that runs from the last index down and swaps index
 * {@code i} with {@code random.nextInt(i + 1)}. Given the same seed and the same input grid the
 * output is identical.
 */
public class MazeGenerator implements IGridGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(MazeGenerator.class);

    // UP, DOWN, LEFT, RIGHT, two cells away
    private static final int[][] STEPS = {{-2, 0}, {2, 0}, {0, -2}, {0, 2}};

    private final IRandomProvider random;
    private final char wall;
    private final char floor;
    private final Cell start;

    /**
     * Creates a generator that starts from a random odd-aligned interior cell.
     * @param random The random source.
     */
    public MazeGenerator(IRandomProvider random) {
        this(random, Config.WALL, Config.FLOOR, null);
    }

    /**
     * Creates a generator.
     * @param random The random source.
     * @param wall The symbol the maze is carved out of. Only used for logging; the grid is expected to be filled with it.
     * @param floor The symbol written to carved cells.
     * @param start The preferred start cell, or null for a random one.
     */
    public MazeGenerator(IRandomProvider random, char wall, char floor, Cell start) {
        this.random = Objects.requireNonNull(random, "Random provider cannot be null.");
        this.wall = wall;
        this.floor = floor;
        this.start = start;
    }

    @Override
    public void generate(Grid grid) {
        carve(grid);
    }

    /**
     * Carves the maze, starting from the configured or a random start cell.
     * @param grid A grid filled with the wall symbol.
     * @return The clamped start and the number of carved cells.
     */
    public MazeResult carve(Grid grid) {
        Cell from = start;
        if (from == null) {
            from = hasInterior(grid) ? randomStart(grid) : new Cell(1, 1);
        }
        return carve(grid, from);
    }

    /**
     * Carves the maze from an explicit start cell. The start is clamped into the interior and
     * aligned to odd coordinates first.
     * @param grid A grid filled with the wall symbol.
     * @param requestedStart The requested start cell.
     * @return The clamped start and the number of carved cells.
     */
    public MazeResult carve(Grid grid, Cell requestedStart) {
        Objects.requireNonNull(requestedStart, "Start cell cannot be null.");
        if (!hasInterior(grid)) {
            LOG.warn("Grid '{}' is {}x{}, too small to carve a maze; leaving it untouched",
                    grid.getName(), grid.getWidth(), grid.getHeight());
            return MazeResult.empty();
        }

        int width = grid.getWidth();
        int height = grid.getHeight();
        Cell origin = new Cell(alignOdd(requestedStart.row(), height), alignOdd(requestedStart.col(), width));
        if (!origin.equals(requestedStart)) {
            LOG.debug("Clamped maze start {} to {} on grid '{}'", requestedStart, origin, grid.getName());
        }

        boolean[] visited = new boolean[width * height];
        IntArrayList stack = new IntArrayList();
        int[] order = {0, 1, 2, 3};

        int carved = 0;
        visited[origin.row() * width + origin.col()] = true;
        grid.set(origin, floor);
        carved++;
        stack.push(origin.row() * width + origin.col());

        while (!stack.isEmpty()) {
            int current = stack.topInt();
            int row = current / width;
            int col = current % width;

            shuffle(order);
            int next = -1;
            int nextStep = -1;
            for (int i : order) {
                int r = row + STEPS[i][0];
                int c = col + STEPS[i][1];
                if (isInterior(r, c, width, height) && !visited[r * width + c]) {
                    next = r * width + c;
                    nextStep = i;
                    break;
                }
            }

            if (next == -1) {
                stack.popInt();
                continue;
            }

            int nextRow = next / width;
            int nextCol = next % width;
            grid.set(row + STEPS[nextStep][0] / 2, col + STEPS[nextStep][1] / 2, floor);
            grid.set(nextRow, nextCol, floor);
            carved += 2;
            visited[next] = true;
            stack.push(next);
        }

        LOG.debug("Carved {} cells out of '{}' on grid '{}' starting at {}", carved, wall, grid.getName(), origin);
        return new MazeResult(origin, carved);
    }

    private Cell randomStart(Grid grid) {
        // Odd interior coordinates are 1, 3, ..., the largest odd value <= dim - 2.
        int oddRows = (grid.getHeight() - 1) / 2;
        int oddCols = (grid.getWidth() - 1) / 2;
        return new Cell(2 * random.nextInt(oddRows) + 1, 2 * random.nextInt(oddCols) + 1);
    }

    private void shuffle(int[] order) {
        for (int i = order.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
    }

    /**
     * Clamps a coordinate into {@code [1, dimension - 2]} and makes it odd.
     * @param value The requested coordinate.
     * @param dimension The grid extent along this axis, at least 3.
     * @return The aligned coordinate.
     */
    static int alignOdd(int value, int dimension) {
        int clamped = Math.max(1, Math.min(value, dimension - 2));
        if (clamped % 2 == 0) {
            clamped--;
        }
        return clamped;
    }

    private static boolean isInterior(int row, int col, int width, int height) {
        return row >= 1 && row <= height - 2 && col >= 1 && col <= width - 2;
    }

    private static boolean hasInterior(Grid grid) {
        return grid.getWidth() >= Config.MIN_CARVABLE_DIMENSION && grid.getHeight() >= Config.MIN_CARVABLE_DIMENSION;
    }
}
