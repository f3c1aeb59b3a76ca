package max.pente.engine.game.board.utils;

public final class BoardUtils {
    public static final int SIZE = 19;
    public static final int CELLS = SIZE * SIZE;
    public static final int CENTER = SIZE / 2;

    // Half of the 8 compass directions, the other half is walked with a negated step
    public static final int[] DIRECTION_ROWS = {0, 1, 1, 1};
    public static final int[] DIRECTION_COLS = {1, 0, 1, -1};

    private BoardUtils() {}

    public static boolean isOnBoard(int row, int col) {
        return row >= 0 && row < SIZE && col >= 0 && col < SIZE;
    }

    public static int chebyshevDistance(int row, int col, int otherRow, int otherCol) {
        return Math.max(Math.abs(row - otherRow), Math.abs(col - otherCol));
    }

    public static int distanceFromCenter(int row, int col) {
        return chebyshevDistance(row, col, CENTER, CENTER);
    }

    public static int manhattanDistanceFromCenter(int row, int col) {
        return Math.abs(row - CENTER) + Math.abs(col - CENTER);
    }
}
