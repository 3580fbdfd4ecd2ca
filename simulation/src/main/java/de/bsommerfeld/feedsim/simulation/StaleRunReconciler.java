package de.bsommerfeld.feedsim.simulation;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.config.ReconciliationConfig;
import de.bsommerfeld.feedsim.core.domain.Run;
import de.bsommerfeld.feedsim.core.domain.RunStatus;
import de.bsommerfeld.feedsim.core.event.ApplicationEventBus;
import de.bsommerfeld.feedsim.core.event.SimulationEvents.StaleRunFailedEvent;
import de.bsommerfeld.feedsim.core.util.Timestamps;
import de.bsommerfeld.feedsim.db.exception.InvalidTransitionException;
import de.bsommerfeld.feedsim.db.repository.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fails runs that were abandoned in {@link RunStatus#RUNNING}, e.g. because
 * the process was killed mid-run. A run counts as abandoned once its
 * {@code startedAt} is older than
 * {@link ReconciliationConfig#staleAfter()}.
 */
@Singleton
public class StaleRunReconciler {

    private static final Logger LOG = LoggerFactory.getLogger(StaleRunReconciler.class);

    private final RunRepository runRepository;
    private final ReconciliationConfig config;
    private final ApplicationEventBus eventBus;
    private final Clock clock;

    @Inject
    public StaleRunReconciler(RunRepository runRepository, ReconciliationConfig config,
            ApplicationEventBus eventBus, Clock clock) {
        this.runRepository = runRepository;
        this.config = config;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * @return the runs that were moved to {@link RunStatus#FAILED}
     */
    public List<Run> reconcile() {
        List<Run> failed = new ArrayList<>();
        if (!config.isEnabled()) {
            LOG.debug("Stale run reconciliation disabled");
            return failed;
        }

        Instant cutoff = Timestamps.now(clock).minus(config.staleAfter());
        for (Run run : runRepository.listRuns()) {
            if (run.status() != RunStatus.RUNNING || !run.startedAt().isBefore(cutoff)) {
                continue;
            }
            try {
                failed.add(runRepository.updateRunStatus(run.runId(), RunStatus.FAILED));
            } catch (InvalidTransitionException e) {
                // finished by another process since listRuns()
                LOG.info("Run {} reached {} before it could be reconciled", run.runId(),
                        e.getCurrentStatus().value());
                continue;
            }
            LOG.warn("Marked abandoned run {} (started {}) as failed", run.runId(), run.startedAt());
            eventBus.post(new StaleRunFailedEvent(run.runId()));
        }
        return failed;
    }
}
