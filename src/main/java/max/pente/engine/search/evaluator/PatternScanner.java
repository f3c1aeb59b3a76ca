package max.pente.engine.search.evaluator;

import max.pente.engine.game.board.Board;
import max.pente.engine.game.board.utils.BoardUtils;
import max.pente.engine.utils.ColorUtils;

/**
 * Scores the lines of stones on the board with {@link PatternValues}.
 * <p>
 * A run is only measured from its first stone (the previous cell along the direction holds
 * something else), so each run is counted once per direction. Runs are strictly contiguous:
 * an empty cell ends them.
 */
public final class PatternScanner {
    public static final int OWN = 0;
    public static final int OPPONENT = 1;

    private PatternScanner() {}

    /**
     * Writes the summed run values of {@code color} in {@code totals[OWN]} and the ones of its
     * opponent in {@code totals[OPPONENT]}.
     */
    public static void scan(Board board, byte color, long[] totals) {
        totals[OWN] = 0;
        totals[OPPONENT] = 0;
        for (int row = 0; row < BoardUtils.SIZE; row++) {
            for (int col = 0; col < BoardUtils.SIZE; col++) {
                final byte stone = board.get(row, col);
                if (stone == ColorUtils.EMPTY) {
                    continue;
                }
                final int side = stone == color ? OWN : OPPONENT;
                for (int d = 0; d < BoardUtils.DIRECTION_ROWS.length; d++) {
                    totals[side] += scoreRunFrom(board, row, col, BoardUtils.DIRECTION_ROWS[d], BoardUtils.DIRECTION_COLS[d], stone);
                }
            }
        }
    }

    static int scoreRunFrom(Board board, int row, int col, int dr, int dc, byte stone) {
        final int beforeRow = row - dr, beforeCol = col - dc;
        final boolean beforeOnBoard = BoardUtils.isOnBoard(beforeRow, beforeCol);
        if (beforeOnBoard && board.get(beforeRow, beforeCol) == stone) {
            return 0;
        }

        int length = 0;
        int r = row, c = col;
        while (length < 5 && BoardUtils.isOnBoard(r, c) && board.get(r, c) == stone) {
            length++;
            r += dr;
            c += dc;
        }
        if (length < 2) {
            return 0;
        }

        int openEnds = 0;
        if (beforeOnBoard && board.get(beforeRow, beforeCol) == ColorUtils.EMPTY) {
            openEnds++;
        }
        if (BoardUtils.isOnBoard(r, c) && board.get(r, c) == ColorUtils.EMPTY) {
            openEnds++;
        }
        return PatternValues.valueOf(length, openEnds);
    }
}
