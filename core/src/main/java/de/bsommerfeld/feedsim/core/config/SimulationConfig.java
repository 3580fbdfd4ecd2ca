package de.bsommerfeld.feedsim.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Root of {@code feedsim.toml}. Each section maps to its own POJO; every
 * field carries a default so that a missing file or section still yields a
 * usable configuration.
 */
@JsonPropertyOrder({ "database", "feed", "run", "reconciliation" })
public class SimulationConfig {

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("feed")
    private FeedConfig feed = new FeedConfig();

    @JsonProperty("run")
    private RunDefaultsConfig run = new RunDefaultsConfig();

    @JsonProperty("reconciliation")
    private ReconciliationConfig reconciliation = new ReconciliationConfig();

    public DatabaseConfig getDatabase() {
        return database;
    }

    public FeedConfig getFeed() {
        return feed;
    }

    public RunDefaultsConfig getRun() {
        return run;
    }

    public ReconciliationConfig getReconciliation() {
        return reconciliation;
    }

    /**
     * Checks value ranges that the TOML types cannot express.
     *
     * @throws IllegalArgumentException naming the first offending key
     */
    public void validate() {
        if (database.getBusyTimeoutMs() < 0) {
            throw new IllegalArgumentException("database.busy-timeout-ms must be >= 0");
        }
        if (feed.getAlgorithm() == null || feed.getAlgorithm().isBlank()) {
            throw new IllegalArgumentException("feed.algorithm cannot be empty");
        }
        if (feed.getMaxPosts() <= 0) {
            throw new IllegalArgumentException("feed.max-posts must be greater than 0");
        }
        if (run.getNumAgents() <= 0) {
            throw new IllegalArgumentException("run.num-agents must be greater than 0");
        }
        if (run.getNumTurns() <= 0) {
            throw new IllegalArgumentException("run.num-turns must be greater than 0");
        }
        if (reconciliation.getStaleAfterHours() <= 0) {
            throw new IllegalArgumentException("reconciliation.stale-after-hours must be greater than 0");
        }
    }
}
