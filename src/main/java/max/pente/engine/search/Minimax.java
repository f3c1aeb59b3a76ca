package max.pente.engine.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.pente.engine.game.Game;
import max.pente.engine.search.evaluator.GameValues;

import static max.pente.engine.search.SearchConstants.INF;

final class Minimax implements TreeSearch {
    static final Minimax INSTANCE = new Minimax();

    private Minimax() {}

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

        final byte mover = maximizing ? ctx.color : ctx.opponent;
        int best = maximizing ? -INF : INF;
        for (int i = 0; i < moves.size(); i++) {
            final int mv = moves.getInt(i);
            game.makeMove(mv, mover);
            final int score = search(game, ctx, depth - 1, ply + 1, alpha, beta, !maximizing);
            game.undoMove(mv);
            best = maximizing ? Math.max(best, score) : Math.min(best, score);
        }
        return best;
    }

    @Override
    public boolean usesWindow() {
        return false;
    }
}
