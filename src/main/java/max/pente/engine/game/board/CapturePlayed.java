package max.pente.engine.game.board;

import max.pente.engine.utils.ColorUtils;

/**
 * Captures made by a single move: the pairs removed from {@code opponentColor}.
 * {@link #NONE} stands for a move that captured nothing.
 */
public record CapturePlayed(byte capturingColor, byte opponentColor, int pairCount, int[] removedCells) {
    public static final CapturePlayed NONE = new CapturePlayed(ColorUtils.EMPTY, ColorUtils.EMPTY, 0, new int[0]);

    public boolean isNone() {
        return pairCount == 0;
    }
}
