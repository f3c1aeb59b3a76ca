package max.pente.engine.game.rules;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.pente.engine.game.board.Board;
import max.pente.engine.game.board.CapturePlayed;
import max.pente.engine.game.board.utils.BoardUtils;
import max.pente.engine.utils.ColorUtils;

/**
 * Custodial captures: a move that closes {@code X O O X} along any of the 8 directions
 * removes the two {@code O} stones.
 */
public final class CaptureRules {

    private CaptureRules() {}

    /**
     * Removes every pair bracketed by the stone just played at {@code (row, col)}.
     * Each direction is checked on its own, so a single move can capture several pairs.
     *
     * @return the consolidated record of this move, {@link CapturePlayed#NONE} when nothing was taken
     */
    public static CapturePlayed captureAround(Board board, int row, int col, byte color) {
        final byte opponent = ColorUtils.switchColor(color);
        IntArrayList removed = null;
        int pairs = 0;

        for (int d = 0; d < BoardUtils.DIRECTION_ROWS.length; d++) {
            for (int sign = 1; sign >= -1; sign -= 2) {
                final int dr = BoardUtils.DIRECTION_ROWS[d] * sign;
                final int dc = BoardUtils.DIRECTION_COLS[d] * sign;
                final int r3 = row + 3 * dr, c3 = col + 3 * dc;
                if (!BoardUtils.isOnBoard(r3, c3)) {
                    continue;
                }
                final int r1 = row + dr, c1 = col + dc;
                final int r2 = row + 2 * dr, c2 = col + 2 * dc;
                if (board.get(r1, c1) == opponent
                        && board.get(r2, c2) == opponent
                        && board.get(r3, c3) == color) {
                    final int first = r1 * BoardUtils.SIZE + c1;
                    final int second = r2 * BoardUtils.SIZE + c2;
                    board.remove(first);
                    board.remove(second);
                    if (removed == null) {
                        removed = new IntArrayList(4);
                    }
                    removed.add(first);
                    removed.add(second);
                    pairs++;
                }
            }
        }

        if (pairs == 0) {
            return CapturePlayed.NONE;
        }
        return new CapturePlayed(color, opponent, pairs, removed.toIntArray());
    }

    public static void restore(Board board, CapturePlayed capture) {
        for (int cell : capture.removedCells()) {
            board.place(cell, capture.opponentColor());
        }
    }
}
