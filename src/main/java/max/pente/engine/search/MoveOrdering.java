package max.pente.engine.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import max.pente.engine.game.Game;
import max.pente.engine.search.evaluator.Evaluator;

/**
 * Candidate ordering and truncation helpers.
 */
final class MoveOrdering {

    private MoveOrdering() {}

    static void truncate(IntArrayList moves, int width) {
        if (moves.size() > width) {
            moves.size(width);
        }
    }

    /** Row-major order, so that equal inputs always give the same search. */
    static void sortByCell(IntArrayList moves) {
        IntArrays.quickSort(moves.elements(), 0, moves.size());
    }

    /**
     * Plays every move for {@code color}, scores the position with {@code evaluator} and
     * insertion-sorts the moves best first. Ties keep their incoming order.
     */
    static void orderByStaticEval(Game game, IntArrayList moves, byte color, Evaluator evaluator) {
        final int n = moves.size();
        final int[] scores = new int[n];
        final int[] buffer = moves.elements();
        for (int i = 0; i < n; i++) {
            final int mv = buffer[i];
            game.makeMove(mv, color);
            scores[i] = evaluator.evaluate(game, color);
            game.undoMove(mv);
        }

        // insertion sort by score desc
        for (int i = 1; i < n; i++) {
            int m = buffer[i], s = scores[i], j = i - 1;
            while (j >= 0 && scores[j] < s) {
                buffer[j + 1] = buffer[j];
                scores[j + 1] = scores[j];
                j--;
            }
            buffer[j + 1] = m;
            scores[j + 1] = s;
        }
    }
}
