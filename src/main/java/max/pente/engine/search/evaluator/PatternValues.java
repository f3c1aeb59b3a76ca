package max.pente.engine.search.evaluator;

public final class PatternValues {
    public static final int FIVE = 1_000_000;
    public static final int OPEN_FOUR = 100_000;
    public static final int FOUR = 50_000;
    public static final int OPEN_THREE = 10_000;
    public static final int THREE = 1_000;
    public static final int OPEN_TWO = 500;
    public static final int TWO = 10;

    private PatternValues() {}

    /** Value of a contiguous run of {@code length} stones with {@code openEnds} empty neighbours (0 to 2). */
    public static int valueOf(int length, int openEnds) {
        if (length >= 5) return FIVE;
        final boolean open = openEnds == 2;
        return switch (length) {
            case 4 -> open ? OPEN_FOUR : FOUR;
            case 3 -> open ? OPEN_THREE : THREE;
            case 2 -> open ? OPEN_TWO : TWO;
            default -> 0;
        };
    }
}
