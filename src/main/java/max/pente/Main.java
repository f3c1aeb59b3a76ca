package max.pente;

import max.pente.runner.Benchmark;
import max.pente.runner.MatchRunner;
import max.pente.runner.RunnerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            RunnerOptions options = RunnerOptions.fromSystemProperties();
            if (options.benchmark()) {
                new Benchmark(options).run();
            } else {
                new MatchRunner(options).run();
            }
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
        }
    }
}
