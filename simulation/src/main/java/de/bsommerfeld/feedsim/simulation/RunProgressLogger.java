package de.bsommerfeld.feedsim.simulation;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.RunStatus;
import de.bsommerfeld.feedsim.core.domain.TurnAction;
import de.bsommerfeld.feedsim.core.event.ApplicationEventBus;
import de.bsommerfeld.feedsim.core.event.SimulationEvents.RunFinishedEvent;
import de.bsommerfeld.feedsim.core.event.SimulationEvents.RunStartedEvent;
import de.bsommerfeld.feedsim.core.event.SimulationEvents.StaleRunFailedEvent;
import de.bsommerfeld.feedsim.core.event.SimulationEvents.TurnCompletedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs run lifecycle events published on the {@link ApplicationEventBus}.
 */
@Singleton
public class RunProgressLogger {

    private static final Logger LOG = LoggerFactory.getLogger(RunProgressLogger.class);

    @Inject
    public RunProgressLogger(ApplicationEventBus eventBus) {
        eventBus.register(this);
    }

    @Subscribe
    public void onRunStarted(RunStartedEvent event) {
        LOG.info("Run {} started: {} agents, {} turns", event.runId(), event.totalAgents(), event.totalTurns());
    }

    @Subscribe
    public void onTurnCompleted(TurnCompletedEvent event) {
        LOG.info("Run {} turn {} completed in {} ms: {} likes, {} comments, {} follows",
                event.runId(), event.turnNumber(), event.executionTimeMs(),
                event.totalActions().getOrDefault(TurnAction.LIKE, 0),
                event.totalActions().getOrDefault(TurnAction.COMMENT, 0),
                event.totalActions().getOrDefault(TurnAction.FOLLOW, 0));
    }

    @Subscribe
    public void onRunFinished(RunFinishedEvent event) {
        if (event.status() == RunStatus.COMPLETED) {
            LOG.info("Run {} completed", event.runId());
        } else {
            LOG.error("Run {} finished as {}: {}", event.runId(), event.status().value(), event.failureMessage());
        }
    }

    @Subscribe
    public void onStaleRunFailed(StaleRunFailedEvent event) {
        LOG.warn("Run {} was abandoned and has been marked failed", event.runId());
    }
}
