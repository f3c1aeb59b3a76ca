package max.pente.engine.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.pente.engine.game.Game;
import max.pente.engine.movegen.Move;

/**
 * One-ply scan run before any tree search, so that an immediate win is never missed and an
 * immediate loss is always blocked, whatever the configured depth.
 */
final class ForcedMoves {

    private ForcedMoves() {}

    /** First candidate that wins on the spot for {@code color}, or {@link Move#NONE}. */
    static int findWinningMove(Game game, IntArrayList candidates, byte color) {
        for (int i = 0; i < candidates.size(); i++) {
            final int mv = candidates.getInt(i);
            if (!game.makeMove(mv, color)) {
                continue;
            }
            final boolean wins = game.winner() == color;
            game.undoMove(mv);
            if (wins) {
                return mv;
            }
        }
        return Move.NONE;
    }

    /** First cell where {@code opponent} would win next move, to be occupied first. */
    static int findBlockingMove(Game game, IntArrayList candidates, byte opponent) {
        return findWinningMove(game, candidates, opponent);
    }
}
