package max.pente.engine.movegen;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.pente.engine.game.Game;
import max.pente.engine.game.board.Board;
import max.pente.engine.game.board.utils.BoardUtils;
import max.pente.engine.utils.ColorUtils;

/**
 * Candidate moves: empty cells close to the stones already on the board.
 * Keeps the branching factor around the action instead of the 361 cells of the grid.
 */
public final class CandidateGenerator {
    public static final int TOURNAMENT_MIN_DISTANCE = 3;

    private CandidateGenerator() {}

    public static IntArrayList generateMoves(Game game, int radius) {
        IntArrayList moves = new IntArrayList(64);
        generateMoves(game, radius, moves);
        return moves;
    }

    /**
     * Fills {@code out} with every empty cell within Chebyshev {@code radius} of a stone,
     * each cell once, in row-major order. An empty board only offers its centre.
     *
     * @return the number of candidates written
     */
    public static int generateMoves(Game game, int radius, IntArrayList out) {
        out.clear();
        final Board board = game.board();
        if (board.hasNoStone()) {
            out.add(Move.asBytes(BoardUtils.CENTER, BoardUtils.CENTER));
            return 1;
        }
        if (game.isTournamentRestricted()) {
            return generateTournamentRing(board, out);
        }

        final boolean[] marked = new boolean[BoardUtils.CELLS];
        for (int row = 0; row < BoardUtils.SIZE; row++) {
            for (int col = 0; col < BoardUtils.SIZE; col++) {
                if (board.get(row, col) == ColorUtils.EMPTY) {
                    continue;
                }
                final int rowFrom = Math.max(0, row - radius), rowTo = Math.min(BoardUtils.SIZE - 1, row + radius);
                final int colFrom = Math.max(0, col - radius), colTo = Math.min(BoardUtils.SIZE - 1, col + radius);
                for (int r = rowFrom; r <= rowTo; r++) {
                    for (int c = colFrom; c <= colTo; c++) {
                        marked[r * BoardUtils.SIZE + c] = true;
                    }
                }
            }
        }

        for (int cell = 0; cell < BoardUtils.CELLS; cell++) {
            if (marked[cell] && board.isEmpty(cell)) {
                out.add(cell);
            }
        }
        return out.size();
    }

    // First player's second move under the tournament rule: closest legal cells to the centre
    private static int generateTournamentRing(Board board, IntArrayList out) {
        for (int row = 0; row < BoardUtils.SIZE; row++) {
            for (int col = 0; col < BoardUtils.SIZE; col++) {
                final int cell = row * BoardUtils.SIZE + col;
                if (BoardUtils.distanceFromCenter(row, col) == TOURNAMENT_MIN_DISTANCE && board.isEmpty(cell)) {
                    out.add(cell);
                }
            }
        }
        return out.size();
    }
}
