package max.pente.engine.search;

/**
 * Tree search flavour, with the candidate pruning each one is tuned for.
 * Alpha-beta prunes, so it can afford a wider radius and more candidates per node.
 */
public enum Algorithm {
    MINIMAX("minimax", 1, 1, 8, 5, false) {
        @Override
        TreeSearch treeSearch() {
            return Minimax.INSTANCE;
        }
    },
    ALPHA_BETA("alphabeta", 2, 2, 15, 10, true) {
        @Override
        TreeSearch treeSearch() {
            return AlphaBeta.INSTANCE;
        }
    };

    private final String tag;
    final int defaultRootRadius;
    final int defaultNodeRadius;
    final int defaultRootWidth;
    final int defaultNodeWidth;
    final boolean defaultRootOrdering;

    Algorithm(String tag, int defaultRootRadius, int defaultNodeRadius,
              int defaultRootWidth, int defaultNodeWidth, boolean defaultRootOrdering) {
        this.tag = tag;
        this.defaultRootRadius = defaultRootRadius;
        this.defaultNodeRadius = defaultNodeRadius;
        this.defaultRootWidth = defaultRootWidth;
        this.defaultNodeWidth = defaultNodeWidth;
        this.defaultRootOrdering = defaultRootOrdering;
    }

    abstract TreeSearch treeSearch();

    public String tag() {
        return tag;
    }

    public static Algorithm fromTag(String tag) {
        String normalized = tag.replace("-", "").replace("_", "");
        for (Algorithm algorithm : values()) {
            if (algorithm.tag.equalsIgnoreCase(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown search algorithm " + tag);
    }
}
