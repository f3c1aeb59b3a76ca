package max.pente.engine.search.evaluator;

import max.pente.engine.game.Game;
import max.pente.engine.game.board.Board;
import max.pente.engine.game.board.utils.BoardUtils;
import max.pente.engine.utils.ColorUtils;

/**
 * H2: positional play. Stones near the centre earn a bonus and the opponent's lines are
 * penalised half again more than our own are rewarded.
 */
public final class StrategicEvaluator implements Evaluator {
    public static final StrategicEvaluator INSTANCE = new StrategicEvaluator();

    public static final int CAPTURE_WEIGHT = 500;
    public static final int CENTRALITY_BASE = 20;

    private StrategicEvaluator() {}

    @Override
    public int evaluate(Game game, byte color) {
        final byte opponent = ColorUtils.switchColor(color);
        if (game.winner() == color) return GameValues.MAX_EVAL;
        if (game.winner() == opponent) return -GameValues.MAX_EVAL;

        long score = (long) (game.captures(color) - game.captures(opponent)) * CAPTURE_WEIGHT;
        score += centrality(game.board(), color);

        final long[] patterns = new long[2];
        PatternScanner.scan(game.board(), color, patterns);
        score += patterns[PatternScanner.OWN];
        score -= patterns[PatternScanner.OPPONENT] * 3 / 2;

        return GameValues.clamp(score);
    }

    static int centrality(Board board, byte color) {
        int bonus = 0;
        for (int row = 0; row < BoardUtils.SIZE; row++) {
            for (int col = 0; col < BoardUtils.SIZE; col++) {
                if (board.get(row, col) == color) {
                    bonus += CENTRALITY_BASE - BoardUtils.manhattanDistanceFromCenter(row, col);
                }
            }
        }
        return bonus;
    }
}
