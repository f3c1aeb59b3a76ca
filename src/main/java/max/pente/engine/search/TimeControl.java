package max.pente.engine.search;

final class TimeControl {
    static boolean softLimitExceeded(long startNs, long softTimeLimitMs) {
        return softTimeLimitMs > 0 && System.nanoTime() - startNs >= softTimeLimitMs * 1_000_000L;
    }

    static long elapsedMs(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000L;
    }
}
