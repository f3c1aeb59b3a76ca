package max.pente.runner;

import max.pente.engine.game.Game;
import max.pente.engine.game.board.utils.BoardGenerator;
import max.pente.engine.search.SearchConfig;
import max.pente.engine.search.SearchFacade;
import max.pente.engine.search.SearchResult;
import max.pente.engine.utils.ColorUtils;
import max.pente.engine.utils.notations.MoveIOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs every search mode on the sample positions for both colors and logs the diagnostic
 * counters side by side.
 */
public final class Benchmark {
    private static final Logger LOG = LoggerFactory.getLogger(Benchmark.class);

    public static final List<String> MODES = List.of("minimax_h1", "alphabeta_h1", "minimax_h2", "alphabeta_h2");

    public record Entry(String position, byte color, String mode, int depth, SearchResult result) {}

    private final RunnerOptions options;

    public Benchmark(RunnerOptions options) {
        this.options = options;
    }

    public List<Entry> run() {
        List<Entry> entries = new ArrayList<>();
        for (Map.Entry<String, String> position : BoardGenerator.SAMPLE_POSITIONS.entrySet()) {
            for (byte color : new byte[]{ColorUtils.BLACK, ColorUtils.WHITE}) {
                for (String mode : MODES) {
                    Game game = BoardGenerator.fromMoves(position.getValue());
                    SearchConfig cfg = options.searchConfig(mode, color);
                    SearchResult result = new SearchFacade(cfg).findBestMove(game);
                    Entry entry = new Entry(position.getKey(), color, mode, cfg.depth, result);
                    entries.add(entry);
                    LOG.info("pos={} side={} {} d={} | nodes={} pruned={} time={}ms move={}",
                            entry.position(), ColorUtils.name(color), mode, cfg.depth,
                            result.nodes(), result.prunedBranches(), result.timeMs(),
                            MoveIOUtils.writeNotation(result.move()));
                }
            }
        }
        logComparisons(entries);
        return entries;
    }

    private static void logComparisons(List<Entry> entries) {
        for (Entry alphaBeta : entries) {
            if (!alphaBeta.mode().startsWith("alphabeta")) {
                continue;
            }
            String heuristic = alphaBeta.mode().substring(alphaBeta.mode().indexOf('_'));
            for (Entry minimax : entries) {
                if (minimax.mode().equals("minimax" + heuristic)
                        && minimax.position().equals(alphaBeta.position())
                        && minimax.color() == alphaBeta.color()) {
                    LOG.info("{}/{}/d{}{}: nodes delta={} time delta={}ms",
                            alphaBeta.position(), ColorUtils.name(alphaBeta.color()), alphaBeta.depth(), heuristic,
                            minimax.result().nodes() - alphaBeta.result().nodes(),
                            minimax.result().timeMs() - alphaBeta.result().timeMs());
                }
            }
        }
    }
}
