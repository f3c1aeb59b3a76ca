package max.pente.engine.search.evaluator;

import max.pente.engine.game.Game;

/** Static evaluation of a position, the higher the better for {@code color}. */
@FunctionalInterface
public interface Evaluator {
    int evaluate(Game game, byte color);
}
