package max.pente.engine.game.board;

import max.pente.engine.game.ZobristHashKeys;
import max.pente.engine.game.board.utils.BoardUtils;
import max.pente.engine.utils.ColorUtils;

import java.util.Arrays;

/**
 * The 19x19 grid, one byte per cell indexed {@code row * 19 + col}.
 * It is the single copy of stone placement; it also keeps the Zobrist key of the stones
 * and the stone count in sync with every write.
 */
public class Board {
    private final byte[] cells;
    private int stoneCount = 0;
    private long zobristKey = 0;

    public Board() {
        this.cells = new byte[BoardUtils.CELLS];
        Arrays.fill(cells, ColorUtils.EMPTY);
    }

    public Board(Board other) {
        this.cells = other.cells.clone();
        this.stoneCount = other.stoneCount;
        this.zobristKey = other.zobristKey;
    }

    public byte get(int cell) {
        return cells[cell];
    }

    public byte get(int row, int col) {
        return cells[row * BoardUtils.SIZE + col];
    }

    // Off-board cells read as EMPTY so line walks don't have to bounds check twice
    public byte getOrEmpty(int row, int col) {
        if (!BoardUtils.isOnBoard(row, col)) {
            return ColorUtils.EMPTY;
        }
        return cells[row * BoardUtils.SIZE + col];
    }

    public boolean isEmpty(int cell) {
        return cells[cell] == ColorUtils.EMPTY;
    }

    public void place(int cell, byte color) {
        cells[cell] = color;
        stoneCount++;
        zobristKey = ZobristHashKeys.switchStone(zobristKey, cell, color);
    }

    public void remove(int cell) {
        byte color = cells[cell];
        if (color == ColorUtils.EMPTY) {
            return;
        }
        cells[cell] = ColorUtils.EMPTY;
        stoneCount--;
        zobristKey = ZobristHashKeys.switchStone(zobristKey, cell, color);
    }

    public int stoneCount() {
        return stoneCount;
    }

    public boolean hasNoStone() {
        return stoneCount == 0;
    }

    public boolean isFull() {
        return stoneCount == BoardUtils.CELLS;
    }

    public long zobristKey() {
        return zobristKey;
    }

    public int countStones(byte color) {
        int count = 0;
        for (byte cell : cells) {
            if (cell == color) {
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Board board = (Board) o;
        return Arrays.equals(cells, board.cells);
    }

    @Override
    public int hashCode() {
        return (int) zobristKey;
    }
}
