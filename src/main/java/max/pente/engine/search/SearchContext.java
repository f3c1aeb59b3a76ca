package max.pente.engine.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.pente.engine.game.Game;
import max.pente.engine.search.evaluator.Evaluator;
import max.pente.engine.utils.ColorUtils;

public final class SearchContext {
    // Candidate buffers per ply, reused across nodes of the same ply
    final IntArrayList[] candidates = new IntArrayList[SearchConstants.MAX_DEPTH + 1];

    // Config, resolved once
    public final SearchConfig cfg;
    final TreeSearch treeSearch;
    final Evaluator evaluator;

    // Side being searched for, may differ from cfg.color for a single call
    byte color;
    byte opponent;

    // Counters
    public long nodes;
    public long prunedBranches;

    public SearchContext(SearchConfig cfg) {
        this.cfg = cfg;
        this.treeSearch = cfg.algorithm.treeSearch();
        this.evaluator = cfg.heuristic.evaluator();
        for (int ply = 0; ply < candidates.length; ply++) {
            candidates[ply] = new IntArrayList(64);
        }
        setColor(cfg.color);
    }

    void setColor(byte color) {
        this.color = color;
        this.opponent = ColorUtils.switchColor(color);
    }

    public void newSearch() {
        nodes = 0;
        prunedBranches = 0;
    }

    int evaluate(Game game) {
        return evaluator.evaluate(game, color);
    }

    public String toInfoString(int depth) {
        return String.format("info %s depth %d nodes %d pruned %d",
                cfg.mode(), depth, nodes, prunedBranches);
    }
}
