package de.bsommerfeld.feedsim.simulation;

import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.util.Modules;
import de.bsommerfeld.feedsim.core.config.SimulationConfig;
import de.bsommerfeld.feedsim.core.domain.AgentAction;
import de.bsommerfeld.feedsim.core.domain.FeedPost;
import de.bsommerfeld.feedsim.core.domain.GeneratedFeed;
import de.bsommerfeld.feedsim.core.domain.Profile;
import de.bsommerfeld.feedsim.core.domain.Run;
import de.bsommerfeld.feedsim.core.domain.RunConfig;
import de.bsommerfeld.feedsim.core.domain.RunStatus;
import de.bsommerfeld.feedsim.core.domain.SocialMediaAgent;
import de.bsommerfeld.feedsim.core.domain.TurnAction;
import de.bsommerfeld.feedsim.core.domain.TurnMetadata;
import de.bsommerfeld.feedsim.db.repository.FeedPostRepository;
import de.bsommerfeld.feedsim.db.repository.ProfileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full Guice wiring against a temporary SQLite file. Agents like every post
 * they are served so that action counts are observable.
 */
class SimulationEngineIntegrationTest {

    @TempDir
    Path tempDir;

    private Injector injector;
    private SimulationEngine engine;

    static class LikeEverythingPolicy extends PassiveActionPolicy {
        @Override
        public List<AgentAction.Like> likePosts(SocialMediaAgent agent, List<FeedPost> feed) {
            List<AgentAction.Like> likes = new ArrayList<>();
            for (FeedPost post : feed) {
                likes.add(AgentAction.Like.of(agent.handle(), post.uri(), Instant.now()));
            }
            return likes;
        }
    }

    @BeforeEach
    void setUp() {
        SimulationConfig config = new SimulationConfig();
        config.getDatabase().setPath(tempDir.resolve("sim.db").toString());
        config.getFeed().setMaxPosts(2);

        injector = Guice.createInjector(Modules.override(new SimulationModule(config)).with(new AbstractModule() {
            @Override
            protected void configure() {
                bind(AgentActionPolicy.class).to(LikeEverythingPolicy.class);
            }
        }));
        engine = injector.getInstance(SimulationEngine.class);

        ProfileRepository profiles = injector.getInstance(ProfileRepository.class);
        profiles.createOrUpdateProfile(new Profile("alice", "did:plc:alice", "Alice", "", 1, 1, 3));
        profiles.createOrUpdateProfile(new Profile("bob", "did:plc:bob", "Bob", "", 1, 1, 2));
        profiles.createOrUpdateProfile(new Profile("carol", "did:plc:carol", "Carol", "", 1, 1, 0));

        List<FeedPost> posts = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            posts.add(post("at://alice/" + i, "alice", i));
            posts.add(post("at://bob/" + i, "bob", 10 + i));
        }
        injector.getInstance(FeedPostRepository.class).createOrUpdateFeedPosts(posts);
    }

    @Test
    void executeRun_shouldCompleteAndRecordEveryTurn() {
        Run run = engine.executeRun(new RunConfig(2, 3));

        assertEquals(RunStatus.COMPLETED, run.status());
        assertNotNull(run.completedAt());
        assertEquals(run, engine.getRun(run.runId()).orElseThrow());

        List<TurnMetadata> turns = engine.listTurnMetadata(run.runId());
        assertEquals(3, turns.size());
        // alice sees bob's 3 posts, bob sees alice's 3; 2 per turn, then the leftover one
        assertEquals(4, turns.get(0).count(TurnAction.LIKE));
        assertEquals(2, turns.get(1).count(TurnAction.LIKE));
        assertEquals(0, turns.get(2).count(TurnAction.LIKE));
        assertEquals(turns.get(1), engine.getTurnMetadata(run.runId(), 1).orElseThrow());
    }

    @Test
    void executeRun_shouldNeverServeSamePostTwiceToAnAgent() {
        Run run = engine.executeRun(new RunConfig(2, 3));

        Set<String> servedToAlice = new HashSet<>();
        for (int turn = 0; turn < 3; turn++) {
            for (GeneratedFeed feed : engine.getTurnFeeds(run.runId(), turn)) {
                if (feed.agentHandle().equals("alice")) {
                    for (String uri : feed.postUris()) {
                        assertTrue(servedToAlice.add(uri), "served twice: " + uri);
                        assertFalse(uri.startsWith("at://alice/"), "own post served: " + uri);
                    }
                }
            }
        }
        assertEquals(3, servedToAlice.size());
    }

    @Test
    void executeRun_shouldLeaveFailedRunWhenProfilesAreMissing() {
        SimulationException e = assertThrows(SimulationException.class,
                () -> engine.executeRun(new RunConfig(10, 1)));

        assertEquals(RunStatus.FAILED, engine.getRun(e.getRunId()).orElseThrow().status());
        assertTrue(engine.listTurnMetadata(e.getRunId()).isEmpty());
    }

    @Test
    void listRuns_shouldReturnNewestFirst() throws InterruptedException {
        Run first = engine.executeRun(new RunConfig(1, 1));
        Thread.sleep(5);
        Run second = engine.executeRun(new RunConfig(1, 1));

        List<Run> runs = engine.listRuns();
        assertEquals(List.of(second.runId(), first.runId()), runs.stream().map(Run::runId).toList());
    }

    private static FeedPost post(String uri, String author, long epochSecond) {
        return new FeedPost(uri, author, author, "text", 0, 0, 0, 0, 0, Instant.ofEpochSecond(epochSecond));
    }
}
