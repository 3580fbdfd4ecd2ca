package de.bsommerfeld.feedsim.simulation;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.feedsim.core.config.ConfigLoader;
import de.bsommerfeld.feedsim.core.config.SimulationConfig;
import de.bsommerfeld.feedsim.core.domain.Run;
import de.bsommerfeld.feedsim.core.domain.RunConfig;
import de.bsommerfeld.feedsim.core.domain.TurnAction;
import de.bsommerfeld.feedsim.core.domain.TurnMetadata;
import de.bsommerfeld.feedsim.core.util.StorageUtils;
import de.bsommerfeld.feedsim.feeds.FeedAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point.
 *
 * <pre>
 *   SimulationMain [--config &lt;path&gt;] [--agents N] [--turns N] [--algorithm NAME] [--list]
 * </pre>
 *
 * Loads the configuration (creating it with defaults if missing), reconciles
 * abandoned runs, then either lists all runs or executes one run and prints a
 * per-turn summary. Exits with {@code 1} on any failure.
 */
public final class SimulationMain {

    private static final Logger LOG = LoggerFactory.getLogger(SimulationMain.class);

    static final String USAGE = "Usage: SimulationMain [--config <path>] [--agents N] [--turns N] "
            + "[--algorithm NAME] [--list]";

    private SimulationMain() {
    }

    public static void main(String[] args) {
        int exitCode = run(args, System.out);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, PrintStream out) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            out.println(USAGE);
            return 1;
        }

        try {
            SimulationConfig config = ConfigLoader.load(
                    options.configPath() != null ? options.configPath() : StorageUtils.getDefaultConfigFile());
            Injector injector = Guice.createInjector(new SimulationModule(config));

            injector.getInstance(StaleRunReconciler.class).reconcile();
            SimulationEngine engine = injector.getInstance(SimulationEngine.class);

            if (options.list()) {
                printRuns(engine, out);
                return 0;
            }

            RunConfig runConfig = new RunConfig(
                    options.agents() != null ? options.agents() : config.getRun().getNumAgents(),
                    options.turns() != null ? options.turns() : config.getRun().getNumTurns(),
                    options.algorithm() != null ? options.algorithm() : config.getFeed().getAlgorithm());
            Run run = engine.executeRun(runConfig);
            printSummary(engine, run, out);
            return 0;
        } catch (RuntimeException e) {
            LOG.error("Simulation failed", e);
            out.println("Simulation failed: " + e.getMessage());
            return 1;
        }
    }

    private static void printRuns(SimulationEngine engine, PrintStream out) {
        for (Run run : engine.listRuns()) {
            out.printf("%s  %-9s  agents=%d turns=%d started=%s%n", run.runId(), run.status().value(),
                    run.totalAgents(), run.totalTurns(), run.startedAt());
        }
    }

    private static void printSummary(SimulationEngine engine, Run run, PrintStream out) {
        out.printf("Run %s %s (%d agents, %d turns)%n", run.runId(), run.status().value(), run.totalAgents(),
                run.totalTurns());
        for (TurnMetadata turn : engine.listTurnMetadata(run.runId())) {
            out.printf("  turn %d: likes=%d comments=%d follows=%d%n", turn.turnNumber(),
                    turn.count(TurnAction.LIKE), turn.count(TurnAction.COMMENT), turn.count(TurnAction.FOLLOW));
        }
    }

    /**
     * Parsed command line. {@code null} fields fall back to the configuration.
     */
    record CliOptions(Path configPath, Integer agents, Integer turns, String algorithm, boolean list) {

        static CliOptions parse(String[] args) {
            Path configPath = null;
            Integer agents = null;
            Integer turns = null;
            String algorithm = null;
            boolean list = false;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--config" -> configPath = Paths.get(value(args, ++i, arg));
                    case "--agents" -> agents = positiveInt(value(args, ++i, arg), arg);
                    case "--turns" -> turns = positiveInt(value(args, ++i, arg), arg);
                    case "--algorithm" -> {
                        algorithm = value(args, ++i, arg);
                        FeedAlgorithm.fromName(algorithm);
                    }
                    case "--list" -> list = true;
                    default -> throw new IllegalArgumentException("Unknown option: " + arg);
                }
            }
            return new CliOptions(configPath, agents, turns, algorithm, list);
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }

        private static int positiveInt(String raw, String option) {
            int value;
            try {
                value = Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(option + " expects a number, got '" + raw + "'", e);
            }
            if (value <= 0) {
                throw new IllegalArgumentException(option + " must be greater than 0");
            }
            return value;
        }
    }
}
