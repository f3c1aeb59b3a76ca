package max.pente.engine.search;

import max.pente.engine.game.Game;

/**
 * Recursive part of a search, below the root. Implementations play and undo moves on
 * {@code game} and must hand it back unchanged.
 */
interface TreeSearch {

    /**
     * @param maximizing true at the plies of the searched color
     * @return the value of the position from the searched color's point of view
     */
    int search(Game game, SearchContext ctx, int depth, int ply, int alpha, int beta, boolean maximizing);

    /** Whether sibling cutoffs may happen, i.e. the root has to keep its window up to date. */
    boolean usesWindow();
}
