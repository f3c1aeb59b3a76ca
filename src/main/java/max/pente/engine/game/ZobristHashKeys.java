package max.pente.engine.game;

import max.pente.engine.game.board.utils.BoardUtils;
import max.pente.engine.utils.ColorUtils;

import java.util.SplittableRandom;

public final class ZobristHashKeys {
    // Capture tallies above this are folded on the last key, a finished game never gets there
    static final int MAX_TRACKED_CAPTURES = 31;
    private static final long SEED = 0x5EED_9E37_79B9_7F4AL;

    private static final long[][] STONE_KEYS = new long[2][BoardUtils.CELLS];
    private static final long[][] CAPTURE_KEYS = new long[2][MAX_TRACKED_CAPTURES + 1];

    static {
        SplittableRandom random = new SplittableRandom(SEED);
        for (int color = 0; color < 2; color++) {
            for (int cell = 0; cell < BoardUtils.CELLS; cell++) {
                STONE_KEYS[color][cell] = random.nextLong();
            }
            // Zero pairs captured keeps the key of an empty board at 0
            for (int count = 1; count <= MAX_TRACKED_CAPTURES; count++) {
                CAPTURE_KEYS[color][count] = random.nextLong();
            }
        }
    }

    private ZobristHashKeys() {}

    public static long switchStone(long key, int cell, int color) {
        return key ^ STONE_KEYS[ColorUtils.index(color)][cell];
    }

    public static long capturesKey(int whiteCaptures, int blackCaptures) {
        return CAPTURE_KEYS[0][Math.min(whiteCaptures, MAX_TRACKED_CAPTURES)]
                ^ CAPTURE_KEYS[1][Math.min(blackCaptures, MAX_TRACKED_CAPTURES)];
    }

    // Full recomputation, use the incremental key on the hot path
    public static long getHashKey(Game game) {
        long key = 0;
        for (int cell = 0; cell < BoardUtils.CELLS; cell++) {
            byte color = game.board().get(cell);
            if (color != ColorUtils.EMPTY) {
                key = switchStone(key, cell, color);
            }
        }
        return key ^ capturesKey(game.captures(ColorUtils.WHITE), game.captures(ColorUtils.BLACK));
    }

    public static String print(long key) {
        return String.format("%016x", key);
    }
}
