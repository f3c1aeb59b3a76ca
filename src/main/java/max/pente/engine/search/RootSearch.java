package max.pente.engine.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.pente.engine.game.Game;
import max.pente.engine.movegen.Move;
import max.pente.engine.search.evaluator.GameValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static max.pente.engine.search.SearchConstants.INF;

final class RootSearch {
    private static final Logger LOG = LoggerFactory.getLogger(RootSearch.class);

    private RootSearch() {}

    static SearchResult search(Game game, SearchContext ctx, long startNs) {
        final SearchConfig cfg = ctx.cfg;
        final int ply = 0;
        final IntArrayList moves = ctx.candidates[ply];
        game.getCandidateMoves(cfg.rootRadius, moves);
        if (moves.isEmpty()) {
            LOG.debug("No candidate left for {}, board is full", cfg.mode());
            return SearchResult.noMove();
        }

        if (cfg.forcedMoveScan) {
            int forced = ForcedMoves.findWinningMove(game, moves, ctx.color);
            if (forced != Move.NONE) {
                LOG.debug("Immediate win at {}", Move.fromBytes(forced));
                return result(ctx, forced, GameValues.WIN_VALUE, startNs, true);
            }
            forced = ForcedMoves.findBlockingMove(game, moves, ctx.opponent);
            if (forced != Move.NONE) {
                LOG.debug("Blocking opponent win at {}", Move.fromBytes(forced));
                return result(ctx, forced, -GameValues.WIN_VALUE, startNs, true);
            }
        }

        if (cfg.orderRootMoves) {
            MoveOrdering.orderByStaticEval(game, moves, ctx.color, ctx.evaluator);
        } else {
            MoveOrdering.sortByCell(moves);
        }
        MoveOrdering.truncate(moves, cfg.rootWidth);

        final TreeSearch tree = ctx.treeSearch;
        int bestMove = moves.getInt(0);
        int bestScore = -INF;
        int alpha = -INF;
        final int beta = INF;

        for (int i = 0; i < moves.size(); i++) {
            final int mv = moves.getInt(i);
            game.makeMove(mv, ctx.color);
            if (game.winner() == ctx.color) {
                game.undoMove(mv);
                return result(ctx, mv, GameValues.WIN_VALUE, startNs, false);
            }
            final int score = tree.search(game, ctx, cfg.depth - 1, ply + 1, alpha, beta, false);
            game.undoMove(mv);

            if (score > bestScore) {
                bestScore = score;
                bestMove = mv;
            }
            if (tree.usesWindow() && bestScore > alpha) {
                alpha = bestScore;
            }
        }

        return result(ctx, bestMove, bestScore, startNs, false);
    }

    private static SearchResult result(SearchContext ctx, int move, int score, long startNs, boolean forced) {
        final boolean overtime = TimeControl.softLimitExceeded(startNs, ctx.cfg.softTimeLimitMs);
        return new SearchResult(move, score, ctx.nodes, ctx.prunedBranches,
                TimeControl.elapsedMs(startNs), forced, overtime);
    }
}
