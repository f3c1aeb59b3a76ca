package max.pente.engine.search;

import max.pente.engine.movegen.Move;
import max.pente.engine.utils.notations.MoveIOUtils;

/**
 * Outcome of one search. {@code move} is {@link Move#NONE} when the board has no empty cell
 * left, which the caller treats as a draw.
 */
public record SearchResult(int move, int score, long nodes, long prunedBranches, long timeMs,
                           boolean forced, boolean softLimitExceeded) {

    public static SearchResult noMove() {
        return new SearchResult(Move.NONE, 0, 0, 0, 0, false, false);
    }

    public boolean hasMove() {
        return move != Move.NONE;
    }

    public int row() {
        return Move.getRow(move);
    }

    public int col() {
        return Move.getCol(move);
    }

    public Move toMove() {
        return Move.fromBytes(move);
    }

    @Override
    public String toString() {
        return "SearchResult\n" +
                "best move: " + MoveIOUtils.writeNotation(move) + (forced ? " (forced)" : "") + "\n" +
                "score: " + score + "\n" +
                "nodes: " + nodes + "\n" +
                "pruned: " + prunedBranches + "\n" +
                "search time (ms): " + timeMs;
    }

    public String toInfoString() {
        return "info move " + MoveIOUtils.writeNotation(move)
                + " score " + score
                + " nodes " + nodes
                + " pruned " + prunedBranches
                + " time " + timeMs
                + (forced ? " forced" : "")
                + (softLimitExceeded ? " overtime" : "");
    }
}
