package max.pente.engine.game.rules;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.pente.engine.game.board.Board;
import max.pente.engine.game.board.utils.BoardUtils;

public final class WinRules {
    public static final int WINNING_CAPTURES = 5;
    public static final int WINNING_LENGTH = 5;

    private WinRules() {}

    /**
     * Looks for a win of {@code color}: five captured pairs, or five stones aligned.
     * The whole board is scanned and the first line of five found is written to
     * {@code sequenceOut} (left untouched for a capture win).
     */
    public static boolean isWinning(Board board, byte color, int captures, IntArrayList sequenceOut) {
        if (captures >= WINNING_CAPTURES) {
            return true;
        }
        return findFive(board, color, sequenceOut);
    }

    public static boolean findFive(Board board, byte color, IntArrayList sequenceOut) {
        for (int row = 0; row < BoardUtils.SIZE; row++) {
            for (int col = 0; col < BoardUtils.SIZE; col++) {
                if (board.get(row, col) != color) {
                    continue;
                }
                for (int d = 0; d < BoardUtils.DIRECTION_ROWS.length; d++) {
                    final int dr = BoardUtils.DIRECTION_ROWS[d];
                    final int dc = BoardUtils.DIRECTION_COLS[d];
                    int length = 1;
                    while (length < WINNING_LENGTH
                            && board.getOrEmpty(row + dr * length, col + dc * length) == color) {
                        length++;
                    }
                    if (length >= WINNING_LENGTH) {
                        sequenceOut.clear();
                        for (int i = 0; i < length; i++) {
                            sequenceOut.add((row + dr * i) * BoardUtils.SIZE + col + dc * i);
                        }
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
