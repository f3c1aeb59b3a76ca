package max.pente.engine.search;

import max.pente.engine.utils.ColorUtils;

public final class SearchConfig {

    public final boolean debug;

    public final byte color;
    public final int depth;
    public final Algorithm algorithm;
    public final HeuristicType heuristic;

    // Candidate pruning, root and interior nodes are tuned independently
    public final int rootRadius;
    public final int nodeRadius;
    public final int rootWidth;
    public final int nodeWidth;
    public final boolean orderRootMoves;   // sort root candidates by one-ply evaluation, best first

    // Short-circuit the tree search on an immediate win or loss
    public final boolean forcedMoveScan;

    // Advisory only: reported and logged, never interrupts a search (0 = none)
    public final long softTimeLimitMs;

    private SearchConfig(Builder b) {
        debug = b.debug;
        color = b.color;
        depth = b.depth;
        algorithm = b.algorithm;
        heuristic = b.heuristic;

        rootRadius = b.rootRadius > 0 ? b.rootRadius : algorithm.defaultRootRadius;
        nodeRadius = b.nodeRadius > 0 ? b.nodeRadius : algorithm.defaultNodeRadius;
        rootWidth = b.rootWidth > 0 ? b.rootWidth : algorithm.defaultRootWidth;
        nodeWidth = b.nodeWidth > 0 ? b.nodeWidth : algorithm.defaultNodeWidth;
        orderRootMoves = b.orderRootMoves != null ? b.orderRootMoves : algorithm.defaultRootOrdering;

        forcedMoveScan = b.forcedMoveScan;
        softTimeLimitMs = b.softTimeLimitMs;
    }

    /** The {@code algorithm_heuristic} tag of this configuration, e.g. {@code alphabeta_h2}. */
    public String mode() {
        return algorithm.tag() + "_" + heuristic.tag();
    }

    public Builder toBuilder() {
        return new Builder()
                .debug(debug).color(color).depth(depth)
                .algorithm(algorithm).heuristic(heuristic)
                .rootRadius(rootRadius).nodeRadius(nodeRadius)
                .rootWidth(rootWidth).nodeWidth(nodeWidth)
                .orderRootMoves(orderRootMoves)
                .forcedMoveScan(forcedMoveScan)
                .softTimeLimitMs(softTimeLimitMs);
    }

    @Override
    public String toString() {
        return mode() + " color=" + ColorUtils.name(color) + " depth=" + depth
                + " root=" + rootWidth + "@r" + rootRadius + " node=" + nodeWidth + "@r" + nodeRadius;
    }

    public static class Builder {
        private boolean debug = false;

        private byte color = ColorUtils.BLACK;
        private int depth = SearchConstants.DEFAULT_DEPTH;
        private Algorithm algorithm = Algorithm.ALPHA_BETA;
        private HeuristicType heuristic = HeuristicType.H2;

        // <= 0 / null: use the algorithm's defaults
        private int rootRadius = -1;
        private int nodeRadius = -1;
        private int rootWidth = -1;
        private int nodeWidth = -1;
        private Boolean orderRootMoves = null;

        private boolean forcedMoveScan = true;
        private long softTimeLimitMs = 0;

        public Builder debug(boolean v){debug=v;return this;}
        public Builder color(byte v){
            if (!ColorUtils.isStone(v)) throw new IllegalArgumentException("Search color must be WHITE or BLACK, got " + v);
            color=v;return this;
        }
        public Builder depth(int v){
            if (v < 1 || v > SearchConstants.MAX_DEPTH) throw new IllegalArgumentException("Search depth out of [1, " + SearchConstants.MAX_DEPTH + "]: " + v);
            depth=v;return this;
        }
        public Builder algorithm(Algorithm v){algorithm=v;return this;}
        public Builder heuristic(HeuristicType v){heuristic=v;return this;}

        /** Parses a tag such as {@code minimax_h1} or {@code alphabeta_h2}. */
        public Builder mode(String tag) {
            int separator = tag.lastIndexOf('_');
            if (separator <= 0 || separator == tag.length() - 1) {
                throw new IllegalArgumentException("Mode must look like <algorithm>_<heuristic>, got " + tag);
            }
            algorithm = Algorithm.fromTag(tag.substring(0, separator));
            heuristic = HeuristicType.fromTag(tag.substring(separator + 1));
            return this;
        }

        public Builder rootRadius(int v){rootRadius=v;return this;}
        public Builder nodeRadius(int v){nodeRadius=v;return this;}
        public Builder rootWidth(int v){rootWidth=v;return this;}
        public Builder nodeWidth(int v){nodeWidth=v;return this;}
        public Builder orderRootMoves(boolean v){orderRootMoves=v;return this;}
        public Builder forcedMoveScan(boolean v){forcedMoveScan=v;return this;}
        public Builder softTimeLimitMs(long v){softTimeLimitMs=v;return this;}
        public SearchConfig build(){return new SearchConfig(this);}
    }
}
