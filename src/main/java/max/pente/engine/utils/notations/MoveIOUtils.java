package max.pente.engine.utils.notations;

import max.pente.engine.game.board.utils.BoardUtils;
import max.pente.engine.movegen.Move;

/**
 * Pente board notation: a column letter from A to T (I is skipped) followed by the row number,
 * so {@code A1} is (row 0, col 0) and {@code K10} is the centre.
 */
public final class MoveIOUtils {
    private static final String COLUMN_LETTERS = "ABCDEFGHJKLMNOPQRST";

    private MoveIOUtils() {}

    public static String writeNotation(int row, int col) {
        return COLUMN_LETTERS.charAt(col) + String.valueOf(row + 1);
    }

    public static String writeNotation(int move) {
        if (move == Move.NONE) {
            return "none";
        }
        return writeNotation(Move.getRow(move), Move.getCol(move));
    }

    public static Move readMove(String notation) {
        if (notation == null || notation.length() < 2 || notation.length() > 3) {
            throw new IllegalArgumentException("Cannot parse move notation " + notation);
        }
        int col = COLUMN_LETTERS.indexOf(Character.toUpperCase(notation.charAt(0)));
        int row;
        try {
            row = Integer.parseInt(notation.substring(1)) - 1;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cannot parse move notation " + notation, e);
        }
        if (col < 0 || !BoardUtils.isOnBoard(row, col)) {
            throw new IllegalArgumentException("Move out of the board " + notation);
        }
        return new Move(row, col);
    }

    public static int readPackedMove(String notation) {
        return readMove(notation).toBytes();
    }
}
