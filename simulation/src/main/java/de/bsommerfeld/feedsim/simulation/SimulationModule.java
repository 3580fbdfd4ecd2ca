package de.bsommerfeld.feedsim.simulation;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.config.DatabaseConfig;
import de.bsommerfeld.feedsim.core.config.FeedConfig;
import de.bsommerfeld.feedsim.core.config.ReconciliationConfig;
import de.bsommerfeld.feedsim.core.config.RunDefaultsConfig;
import de.bsommerfeld.feedsim.core.config.SimulationConfig;
import de.bsommerfeld.feedsim.db.SqliteDatabase;
import de.bsommerfeld.feedsim.db.adapter.FeedPostAdapter;
import de.bsommerfeld.feedsim.db.adapter.GeneratedBioAdapter;
import de.bsommerfeld.feedsim.db.adapter.GeneratedFeedAdapter;
import de.bsommerfeld.feedsim.db.adapter.ProfileAdapter;
import de.bsommerfeld.feedsim.db.adapter.RunAdapter;
import de.bsommerfeld.feedsim.db.adapter.SqlFeedPostAdapter;
import de.bsommerfeld.feedsim.db.adapter.SqlGeneratedBioAdapter;
import de.bsommerfeld.feedsim.db.adapter.SqlGeneratedFeedAdapter;
import de.bsommerfeld.feedsim.db.adapter.SqlProfileAdapter;
import de.bsommerfeld.feedsim.db.adapter.SqlRunAdapter;
import de.bsommerfeld.feedsim.feeds.CandidateSource;
import de.bsommerfeld.feedsim.feeds.RepositoryCandidateSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice wiring for the simulation: configuration sections, the SQLite
 * adapters, the feed pipeline's candidate source and the action policy.
 */
public class SimulationModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(SimulationModule.class);

    private final SimulationConfig config;

    public SimulationModule(SimulationConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(SimulationConfig.class).toInstance(config);

        // Sub-configs for convenience
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(FeedConfig.class).toInstance(config.getFeed());
        bind(RunDefaultsConfig.class).toInstance(config.getRun());
        bind(ReconciliationConfig.class).toInstance(config.getReconciliation());

        bind(Clock.class).toInstance(Clock.systemUTC());

        bind(ProfileAdapter.class).to(SqlProfileAdapter.class);
        bind(FeedPostAdapter.class).to(SqlFeedPostAdapter.class);
        bind(GeneratedBioAdapter.class).to(SqlGeneratedBioAdapter.class);
        bind(GeneratedFeedAdapter.class).to(SqlGeneratedFeedAdapter.class);
        bind(RunAdapter.class).to(SqlRunAdapter.class);

        bind(CandidateSource.class).to(RepositoryCandidateSource.class);
        bind(AgentActionPolicy.class).to(PassiveActionPolicy.class);

        bind(RunProgressLogger.class).asEagerSingleton();
    }

    @Provides
    @Singleton
    SqliteDatabase provideDatabase(DatabaseConfig databaseConfig) {
        Path file = databaseConfig.resolvePath();
        LOG.info("Using database {}", file.toAbsolutePath());
        return new SqliteDatabase(file, databaseConfig.getBusyTimeoutMs());
    }
}
