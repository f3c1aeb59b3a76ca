package max.pente.engine.search;

import max.pente.engine.search.evaluator.AggressiveEvaluator;
import max.pente.engine.search.evaluator.Evaluator;
import max.pente.engine.search.evaluator.StrategicEvaluator;

public enum HeuristicType {
    H1("h1", AggressiveEvaluator.INSTANCE),
    H2("h2", StrategicEvaluator.INSTANCE);

    private final String tag;
    private final Evaluator evaluator;

    HeuristicType(String tag, Evaluator evaluator) {
        this.tag = tag;
        this.evaluator = evaluator;
    }

    public String tag() {
        return tag;
    }

    public Evaluator evaluator() {
        return evaluator;
    }

    public static HeuristicType fromTag(String tag) {
        for (HeuristicType type : values()) {
            if (type.tag.equalsIgnoreCase(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown heuristic " + tag);
    }
}
