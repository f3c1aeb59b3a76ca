package max.pente.engine.search;

import max.pente.engine.game.Game;
import max.pente.engine.game.ZobristHashKeys;
import max.pente.engine.utils.ColorUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Move selection for one AI seat.
 * <p>
 * The game is borrowed for the duration of {@link #findBestMove(Game)}: moves are played and
 * undone on it in place and it is handed back exactly as it came in. The caller applies the
 * returned move itself. Not thread safe, and the game must not be touched by anyone else while
 * a search runs.
 */
public final class SearchFacade {
    private static final Logger LOG = LoggerFactory.getLogger(SearchFacade.class);

    private final SearchContext ctx;

    public SearchFacade(SearchConfig cfg) {
        this.ctx = new SearchContext(cfg);
    }

    public SearchResult findBestMove(Game game) {
        return findBestMove(game, ctx.cfg.color);
    }

    public SearchResult findBestMove(Game game, byte color) {
        ctx.newSearch();
        ctx.setColor(color);
        final long start = System.nanoTime();
        final long keyBefore = game.zobristKey();
        final int historyBefore = game.captureHistoryDepth();

        SearchResult result = RootSearch.search(game, ctx, start);

        if (ctx.cfg.debug) {
            if (keyBefore != game.zobristKey() || historyBefore != game.captureHistoryDepth()) {
                throw new IllegalStateException("Position mutated across search for " + ColorUtils.name(color)
                        + ": key " + ZobristHashKeys.print(keyBefore) + " -> " + ZobristHashKeys.print(game.zobristKey()));
            }
            if (result.hasMove() && !game.isValidMove(result.row(), result.col(), color)) {
                throw new IllegalStateException("Illegal best move " + result.toMove());
            }
        }
        if (result.softLimitExceeded()) {
            LOG.warn("{} went over its soft limit of {} ms ({} ms)", ctx.cfg.mode(), ctx.cfg.softTimeLimitMs, result.timeMs());
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} {}", ctx.toInfoString(ctx.cfg.depth), result.toInfoString());
        }
        return result;
    }

    public long nodesExplored() {
        return ctx.nodes;
    }

    public long prunedBranches() {
        return ctx.prunedBranches;
    }

    public SearchConfig config() {
        return ctx.cfg;
    }
}
