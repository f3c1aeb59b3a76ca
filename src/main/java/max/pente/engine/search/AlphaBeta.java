package max.pente.engine.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.pente.engine.game.Game;
import max.pente.engine.search.evaluator.GameValues;

final class AlphaBeta implements TreeSearch {
    static final AlphaBeta INSTANCE = new AlphaBeta();

    private AlphaBeta() {}

    @Override
    public int search(Game game, SearchContext ctx, int depth, int ply, int alpha, int beta, boolean maximizing) {
        ctx.nodes++;

        if (game.winner() == ctx.color) return GameValues.WIN_VALUE;
        if (game.winner() == ctx.opponent) return -GameValues.WIN_VALUE;
        if (depth <= 0 || game.isFull()) {
            return ctx.evaluate(game);
        }

        final IntArrayList moves = ctx.candidates[ply];
        game.getCandidateMoves(ctx.cfg.nodeRadius, moves);
        MoveOrdering.truncate(moves, ctx.cfg.nodeWidth);
        if (moves.isEmpty()) {
            return ctx.evaluate(game);
        }

        if (maximizing) {
            int best = -SearchConstants.INF;
            for (int i = 0; i < moves.size(); i++) {
                final int mv = moves.getInt(i);
                game.makeMove(mv, ctx.color);
                final int score = search(game, ctx, depth - 1, ply + 1, alpha, beta, false);
                game.undoMove(mv);
                if (score > best) best = score;
                if (best > alpha) alpha = best;
                if (beta <= alpha) {
                    ctx.prunedBranches++;
                    break;
                }
            }
            return best;
        } else {
            int best = SearchConstants.INF;
            for (int i = 0; i < moves.size(); i++) {
                final int mv = moves.getInt(i);
                game.makeMove(mv, ctx.opponent);
                final int score = search(game, ctx, depth - 1, ply + 1, alpha, beta, true);
                game.undoMove(mv);
                if (score < best) best = score;
                if (best < beta) beta = best;
                if (beta <= alpha) {
                    ctx.prunedBranches++;
                    break;
                }
            }
            return best;
        }
    }

    @Override
    public boolean usesWindow() {
        return true;
    }
}
