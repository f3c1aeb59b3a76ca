package max.pente.engine.search.evaluator;

public final class GameValues {
    // A decided game, strictly above anything a heuristic can return
    public static final int WIN_VALUE = 1_000_000_000;
    public static final int MAX_EVAL = WIN_VALUE - 1;

    private GameValues() {}

    public static int clamp(long score) {
        if (score > MAX_EVAL) return MAX_EVAL;
        if (score < -MAX_EVAL) return -MAX_EVAL;
        return (int) score;
    }
}
