package max.pente.runner;

import max.pente.engine.game.Game;
import max.pente.engine.game.board.utils.BoardGenerator;
import max.pente.engine.search.SearchConfig;
import max.pente.engine.search.SearchFacade;
import max.pente.engine.utils.ColorUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MatchRunnerTest {

    @AfterEach
    public void clearProperties() {
        System.clearProperty("pente.mode");
        System.clearProperty("pente.depth");
        System.clearProperty("pente.white");
    }

    private static SearchFacade seat(String mode, byte color) {
        return new SearchFacade(new SearchConfig.Builder().mode(mode).color(color).depth(1).debug(true).build());
    }

    @Test
    public void shortMatchStopsAtTheMoveLimit() {
        Game game = new Game();

        MatchRunner.Outcome outcome = MatchRunner.play(game,
                seat("minimax_h1", ColorUtils.WHITE), seat("minimax_h2", ColorUtils.BLACK), 8);

        if (outcome == MatchRunner.Outcome.MOVE_LIMIT) {
            assertEquals(8, game.moveCount());
        } else {
            assertNotEquals(ColorUtils.EMPTY, game.winner());
        }
        assertEquals(game.moveCount(), game.captureHistoryDepth());
    }

    @Test
    public void matchEndsOnTheWinningMove() {
        // white to move with four on row 10
        Game game = BoardGenerator.fromStones("F10 G10 H10 J10", "E10 A1 A3 A5", ColorUtils.WHITE);

        MatchRunner.Outcome outcome = MatchRunner.play(game,
                seat("alphabeta_h1", ColorUtils.WHITE), seat("alphabeta_h2", ColorUtils.BLACK), 100);

        assertEquals(MatchRunner.Outcome.WHITE_WINS, outcome);
        assertEquals(ColorUtils.WHITE, game.winner());
        assertEquals(5, game.winningSequence().size());
    }

    @Test
    public void optionsComeFromSystemProperties() {
        System.setProperty("pente.depth", "3");
        System.setProperty("pente.white", "minimax_h2");

        RunnerOptions options = RunnerOptions.fromSystemProperties();

        assertFalse(options.benchmark());
        assertEquals(3, options.depth());
        assertEquals("minimax_h2", options.whiteConfig().mode());
        assertEquals(ColorUtils.WHITE, options.whiteConfig().color);
        assertEquals("alphabeta_h2", options.blackConfig().mode());
        assertEquals(ColorUtils.BLACK, options.blackConfig().color);
    }

    @Test
    public void badOptionsAreRejected() {
        System.setProperty("pente.mode", "tournament");
        assertThrows(IllegalArgumentException.class, RunnerOptions::fromSystemProperties);

        System.setProperty("pente.mode", "match");
        System.setProperty("pente.depth", "two");
        assertThrows(IllegalArgumentException.class, RunnerOptions::fromSystemProperties);
    }

    @Test
    public void benchmarkCoversEveryModeAndColor() {
        RunnerOptions options = new RunnerOptions(true, "alphabeta_h1", "alphabeta_h2", 1, 10, false, 0, true);

        List<Benchmark.Entry> entries = new Benchmark(options).run();

        int expected = BoardGenerator.SAMPLE_POSITIONS.size() * 2 * Benchmark.MODES.size();
        assertEquals(expected, entries.size());
        for (Benchmark.Entry entry : entries) {
            assertTrue(entry.result().hasMove(), entry.position() + " " + entry.mode());
        }
    }
}
