package max.pente.engine.search.evaluator;

import max.pente.engine.game.Game;
import max.pente.engine.utils.ColorUtils;

/**
 * H1: captures weigh heavily and our own lines count double what the opponent's cost us.
 */
public final class AggressiveEvaluator implements Evaluator {
    public static final AggressiveEvaluator INSTANCE = new AggressiveEvaluator();

    public static final int CAPTURE_WEIGHT = 1000;

    private AggressiveEvaluator() {}

    @Override
    public int evaluate(Game game, byte color) {
        final byte opponent = ColorUtils.switchColor(color);
        long score = (long) (game.captures(color) - game.captures(opponent)) * CAPTURE_WEIGHT;

        final long[] patterns = new long[2];
        PatternScanner.scan(game.board(), color, patterns);
        score += patterns[PatternScanner.OWN];
        score -= patterns[PatternScanner.OPPONENT] / 2;

        return GameValues.clamp(score);
    }
}
