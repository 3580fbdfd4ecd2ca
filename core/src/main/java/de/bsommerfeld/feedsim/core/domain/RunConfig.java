package de.bsommerfeld.feedsim.core.domain;

/**
 * Parameters of a single simulation run.
 *
 * @param numAgents     number of agents to materialize, {@code > 0}
 * @param numTurns      number of turns to simulate, {@code > 0}
 * @param feedAlgorithm registry name of the ranking algorithm
 */
public record RunConfig(int numAgents, int numTurns, String feedAlgorithm) {

    public static final String DEFAULT_FEED_ALGORITHM = "chronological";

    public RunConfig {
        Validators.requirePositive(numAgents, "num_agents");
        Validators.requirePositive(numTurns, "num_turns");
        Validators.requireNonBlank(feedAlgorithm, "feed_algorithm");
    }

    public RunConfig(int numAgents, int numTurns) {
        this(numAgents, numTurns, DEFAULT_FEED_ALGORITHM);
    }
}
