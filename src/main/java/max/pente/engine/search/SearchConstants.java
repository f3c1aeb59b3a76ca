package max.pente.engine.search;

public class SearchConstants {
    public static final int INF = Integer.MAX_VALUE;

    // Recursion is plain call stack, real games stay far below this
    public static final int MAX_DEPTH = 16;

    public static final int DEFAULT_DEPTH = 2;
}
