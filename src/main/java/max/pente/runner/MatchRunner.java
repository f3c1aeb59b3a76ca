package max.pente.runner;

import max.pente.engine.game.Game;
import max.pente.engine.search.SearchFacade;
import max.pente.engine.search.SearchResult;
import max.pente.engine.utils.ColorUtils;
import max.pente.engine.utils.notations.MoveIOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plays one AI-vs-AI game on a single live board: each seat searches, then the move it
 * returns is applied for good.
 */
public final class MatchRunner {
    private static final Logger LOG = LoggerFactory.getLogger(MatchRunner.class);

    public enum Outcome { WHITE_WINS, BLACK_WINS, DRAW, MOVE_LIMIT }

    private final RunnerOptions options;

    public MatchRunner(RunnerOptions options) {
        this.options = options;
    }

    public Outcome run() {
        Game game = new Game(options.tournamentRule());
        SearchFacade white = new SearchFacade(options.whiteConfig());
        SearchFacade black = new SearchFacade(options.blackConfig());
        LOG.info("New game: WHITE {} vs BLACK {}", white.config(), black.config());

        Outcome outcome = play(game, white, black, options.maxMoves());

        LOG.info("Final position after {} moves:\n{}", game.moveCount(), game);
        LOG.info("Result: {}", outcome);
        return outcome;
    }

    public static Outcome play(Game game, SearchFacade white, SearchFacade black, int maxMoves) {
        while (game.moveCount() < maxMoves) {
            final byte side = game.currentPlayer();
            final SearchFacade seat = ColorUtils.isWhite(side) ? white : black;
            SearchResult result = seat.findBestMove(game, side);
            if (!result.hasMove()) {
                return Outcome.DRAW;
            }
            if (!game.makeMove(result.row(), result.col(), side)) {
                throw new IllegalStateException(ColorUtils.name(side) + " picked an illegal move " + result.toMove());
            }
            LOG.info("{}. {} {} | nodes {} pruned {} {} ms{}", game.moveCount(), ColorUtils.name(side),
                    MoveIOUtils.writeNotation(result.move()), result.nodes(), result.prunedBranches(),
                    result.timeMs(), result.forced() ? " (forced)" : "");

            if (game.winner() != ColorUtils.EMPTY) {
                LOG.info("{} wins with {} captured pairs", ColorUtils.name(game.winner()), game.captures(game.winner()));
                return ColorUtils.isWhite(game.winner()) ? Outcome.WHITE_WINS : Outcome.BLACK_WINS;
            }
            if (game.isFull()) {
                return Outcome.DRAW;
            }
        }
        return Outcome.MOVE_LIMIT;
    }
}
