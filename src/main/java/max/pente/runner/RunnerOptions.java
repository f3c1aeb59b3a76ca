package max.pente.runner;

import max.pente.engine.search.SearchConfig;
import max.pente.engine.utils.ColorUtils;

/**
 * Runner settings, read from JVM system properties ({@code -Dpente.white=minimax_h1 ...}).
 */
public record RunnerOptions(boolean benchmark, String whiteMode, String blackMode, int depth,
                            int maxMoves, boolean tournamentRule, long softLimitMs, boolean debug) {

    public static RunnerOptions fromSystemProperties() {
        String mode = System.getProperty("pente.mode", "match");
        if (!mode.equals("match") && !mode.equals("benchmark")) {
            throw new IllegalArgumentException("pente.mode must be match or benchmark, got " + mode);
        }
        return new RunnerOptions(
                mode.equals("benchmark"),
                System.getProperty("pente.white", "alphabeta_h1"),
                System.getProperty("pente.black", "alphabeta_h2"),
                parseInt("pente.depth", "2"),
                parseInt("pente.maxMoves", "120"),
                Boolean.parseBoolean(System.getProperty("pente.tournament", "false")),
                parseInt("pente.softLimitMs", "0"),
                Boolean.parseBoolean(System.getProperty("pente.debug", "false")));
    }

    private static int parseInt(String property, String defaultValue) {
        String value = System.getProperty(property, defaultValue);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(property + " must be an integer, got " + value, e);
        }
    }

    public SearchConfig searchConfig(String mode, byte color) {
        return new SearchConfig.Builder()
                .mode(mode)
                .color(color)
                .depth(depth)
                .softTimeLimitMs(softLimitMs)
                .debug(debug)
                .build();
    }

    public SearchConfig whiteConfig() {
        return searchConfig(whiteMode, ColorUtils.WHITE);
    }

    public SearchConfig blackConfig() {
        return searchConfig(blackMode, ColorUtils.BLACK);
    }
}
