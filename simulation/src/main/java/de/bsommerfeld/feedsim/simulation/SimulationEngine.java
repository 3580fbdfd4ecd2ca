package de.bsommerfeld.feedsim.simulation;

import com.google.common.base.Stopwatch;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.FeedPost;
import de.bsommerfeld.feedsim.core.domain.GeneratedFeed;
import de.bsommerfeld.feedsim.core.domain.Run;
import de.bsommerfeld.feedsim.core.domain.RunConfig;
import de.bsommerfeld.feedsim.core.domain.RunStatus;
import de.bsommerfeld.feedsim.core.domain.SocialMediaAgent;
import de.bsommerfeld.feedsim.core.domain.TurnAction;
import de.bsommerfeld.feedsim.core.domain.TurnMetadata;
import de.bsommerfeld.feedsim.core.domain.Validators;
import de.bsommerfeld.feedsim.core.event.ApplicationEventBus;
import de.bsommerfeld.feedsim.core.event.SimulationEvents.RunFinishedEvent;
import de.bsommerfeld.feedsim.core.event.SimulationEvents.RunStartedEvent;
import de.bsommerfeld.feedsim.core.event.SimulationEvents.TurnCompletedEvent;
import de.bsommerfeld.feedsim.core.util.Timestamps;
import de.bsommerfeld.feedsim.db.exception.RunCreationException;
import de.bsommerfeld.feedsim.db.repository.GeneratedFeedRepository;
import de.bsommerfeld.feedsim.db.repository.RunRepository;
import de.bsommerfeld.feedsim.feeds.FeedAlgorithm;
import de.bsommerfeld.feedsim.feeds.FeedGenerator;
import de.bsommerfeld.feedsim.feeds.UnknownAlgorithmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Drives a run from creation to a terminal state.
 *
 * <pre>
 *   createRun ─► createAgents ─► turn 0 … turn N-1 ─► COMPLETED
 *                     │               │
 *                     └───── any exception ─────────► FAILED
 * </pre>
 *
 * Each turn generates and hydrates the feeds of all agents, lets every agent
 * act on its feed through the {@link AgentActionPolicy}, and records the
 * action counts as write-once {@link TurnMetadata}.
 *
 * <p>
 * On failure the run is moved to {@link RunStatus#FAILED}. If that update
 * fails as well, the secondary exception is logged and attached to the
 * original as suppressed; the caller always receives a
 * {@link SimulationException} whose cause is the original failure. An
 * {@link Error} also fails the run but is rethrown unchanged.
 *
 * <p>
 * Runs execute sequentially on the calling thread.
 */
@Singleton
public class SimulationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SimulationEngine.class);

    private final RunRepository runRepository;
    private final GeneratedFeedRepository generatedFeedRepository;
    private final AgentFactory agentFactory;
    private final FeedGenerator feedGenerator;
    private final AgentActionPolicy actionPolicy;
    private final ApplicationEventBus eventBus;
    private final Clock clock;

    @Inject
    public SimulationEngine(RunRepository runRepository, GeneratedFeedRepository generatedFeedRepository,
            AgentFactory agentFactory, FeedGenerator feedGenerator, AgentActionPolicy actionPolicy,
            ApplicationEventBus eventBus, Clock clock) {
        this.runRepository = runRepository;
        this.generatedFeedRepository = generatedFeedRepository;
        this.agentFactory = agentFactory;
        this.feedGenerator = feedGenerator;
        this.actionPolicy = actionPolicy;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Executes a full run.
     *
     * @return the run in {@link RunStatus#COMPLETED}
     * @throws UnknownAlgorithmException if the configured algorithm does not
     *                                   exist; no run is created
     * @throws RunCreationException      if the run could not be stored
     * @throws SimulationException       if the run failed after creation
     */
    public Run executeRun(RunConfig config) {
        Validators.requirePresent(config, "config");
        FeedAlgorithm algorithm = FeedAlgorithm.fromName(config.feedAlgorithm());

        Run run = runRepository.createRun(config);
        String runId = run.runId();
        eventBus.post(new RunStartedEvent(runId, run.totalAgents(), run.totalTurns()));

        Integer currentTurn = null;
        try {
            List<SocialMediaAgent> agents = agentFactory.createAgents(config.numAgents());
            for (int turn = 0; turn < run.totalTurns(); turn++) {
                currentTurn = turn;
                simulateTurn(runId, turn, agents, algorithm);
            }
            currentTurn = null;

            Run completed = runRepository.updateRunStatus(runId, RunStatus.COMPLETED);
            eventBus.post(new RunFinishedEvent(runId, RunStatus.COMPLETED, null));
            return completed;
        } catch (RuntimeException | Error e) {
            LOG.error("Run {} failed{}", runId, currentTurn == null ? "" : " in turn " + currentTurn, e);
            markFailed(runId, e);
            eventBus.post(new RunFinishedEvent(runId, RunStatus.FAILED, e.getMessage()));
            if (e instanceof Error error) {
                throw error;
            }
            throw new SimulationException(runId, currentTurn, e);
        }
    }

    public Optional<Run> getRun(String runId) {
        return runRepository.getRun(runId);
    }

    public List<Run> listRuns() {
        return runRepository.listRuns();
    }

    public Optional<TurnMetadata> getTurnMetadata(String runId, int turnNumber) {
        return runRepository.getTurnMetadata(runId, turnNumber);
    }

    public List<TurnMetadata> listTurnMetadata(String runId) {
        return runRepository.listTurnMetadata(runId);
    }

    /** Feeds that were served in one turn, ordered by agent handle. */
    public List<GeneratedFeed> getTurnFeeds(String runId, int turnNumber) {
        return generatedFeedRepository.readFeedsForTurn(runId, turnNumber);
    }

    TurnResult simulateTurn(String runId, int turnNumber, List<SocialMediaAgent> agents,
            FeedAlgorithm algorithm) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        Map<String, List<FeedPost>> feeds = feedGenerator.generateFeeds(agents, runId, turnNumber, algorithm);

        Map<TurnAction, Integer> counts = new EnumMap<>(TurnAction.class);
        for (TurnAction action : TurnAction.values()) {
            counts.put(action, 0);
        }
        for (SocialMediaAgent agent : agents) {
            List<FeedPost> feed = feeds.getOrDefault(agent.handle(), List.of());
            counts.merge(TurnAction.LIKE, actionPolicy.likePosts(agent, feed).size(), Integer::sum);
            counts.merge(TurnAction.COMMENT, actionPolicy.commentPosts(agent, feed).size(), Integer::sum);
            counts.merge(TurnAction.FOLLOW, actionPolicy.followUsers(agent, feed).size(), Integer::sum);
        }

        runRepository.writeTurnMetadata(new TurnMetadata(runId, turnNumber, counts, Timestamps.now(clock)));

        TurnResult result = new TurnResult(turnNumber, counts, stopwatch.elapsed(TimeUnit.MILLISECONDS));
        eventBus.post(new TurnCompletedEvent(runId, turnNumber, result.totalActions(), result.executionTimeMs()));
        return result;
    }

    private void markFailed(String runId, Throwable original) {
        try {
            runRepository.updateRunStatus(runId, RunStatus.FAILED);
        } catch (RuntimeException secondary) {
            LOG.error("Could not mark run {} as failed", runId, secondary);
            original.addSuppressed(secondary);
        }
    }
}
