package max.pente.engine.movegen;

import max.pente.engine.game.board.utils.BoardUtils;
import max.pente.engine.utils.notations.MoveIOUtils;

/**
 * A cell of the board. The hot path passes moves around as packed ints
 * ({@code row * 19 + col}), the record form is for tests, logs and the public API.
 */
public record Move(int row, int col) {
    public static final int NONE = -1;

    public static Move fromBytes(int bytes) {
        if (bytes == NONE) {
            return null;
        }
        return new Move(getRow(bytes), getCol(bytes));
    }

    public static int asBytes(int row, int col) {
        return row * BoardUtils.SIZE + col;
    }

    public static int getRow(int bytes) {
        return bytes / BoardUtils.SIZE;
    }

    public static int getCol(int bytes) {
        return bytes % BoardUtils.SIZE;
    }

    public int toBytes() {
        return asBytes(row, col);
    }

    @Override
    public String toString() {
        return MoveIOUtils.writeNotation(row, col);
    }
}
