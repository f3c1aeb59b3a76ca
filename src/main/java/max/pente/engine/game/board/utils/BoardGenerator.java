package max.pente.engine.game.board.utils;

import max.pente.engine.game.Game;
import max.pente.engine.movegen.Move;
import max.pente.engine.utils.ColorUtils;
import max.pente.engine.utils.notations.MoveIOUtils;

import java.util.LinkedHashMap;
import java.util.Map;

public final class BoardGenerator {
    // White and black each answer around the centre stone
    public static final String CENTER_OPENING = "K10 L10 K11 K9";
    // White holds an open three on row 6
    public static final String OPEN_THREE = "F6 K10 G6 G7 H6";

    public static final Map<String, String> SAMPLE_POSITIONS;

    static {
        SAMPLE_POSITIONS = new LinkedHashMap<>();
        SAMPLE_POSITIONS.put("center", CENTER_OPENING);
        SAMPLE_POSITIONS.put("open_three", OPEN_THREE);
    }

    private BoardGenerator() {}

    public static Game newGame() {
        return new Game();
    }

    public static Game newTournamentGame() {
        return new Game(true);
    }

    public static Game fromMoves(String moves) {
        Game game = new Game();
        game.playMoves(moves);
        return game;
    }

    /**
     * Builds a position stone by stone, without captures nor win detection.
     * The move counter ends up at the number of stones placed, so white is to move when
     * both lists have the same length.
     */
    public static Game fromStones(String whiteStones, String blackStones) {
        Game game = new Game();
        placeAll(game, whiteStones, ColorUtils.WHITE);
        placeAll(game, blackStones, ColorUtils.BLACK);
        return game;
    }

    public static Game fromStones(String whiteStones, String blackStones, byte sideToMove) {
        Game game = fromStones(whiteStones, blackStones);
        if (game.currentPlayer() != sideToMove) {
            game.setupMoveCount(game.moveCount() + 1);
        }
        return game;
    }

    private static void placeAll(Game game, String stones, byte color) {
        if (stones == null || stones.isBlank()) {
            return;
        }
        for (String notation : stones.trim().split("\\s+")) {
            Move move = MoveIOUtils.readMove(notation);
            game.setupStone(move.row(), move.col(), color);
        }
    }
}
