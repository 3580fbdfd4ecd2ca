package de.bsommerfeld.feedsim.simulation;

import de.bsommerfeld.feedsim.core.domain.FeedPost;
import de.bsommerfeld.feedsim.core.domain.Profile;
import de.bsommerfeld.feedsim.db.SqliteDatabase;
import de.bsommerfeld.feedsim.db.adapter.SqlFeedPostAdapter;
import de.bsommerfeld.feedsim.db.adapter.SqlProfileAdapter;
import de.bsommerfeld.feedsim.db.repository.FeedPostRepository;
import de.bsommerfeld.feedsim.db.repository.ProfileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulationMainTest {

    @TempDir
    Path tempDir;

    private Path configFile;
    private ByteArrayOutputStream output;
    private PrintStream out;

    @BeforeEach
    void setUp() throws IOException {
        Path dbFile = tempDir.resolve("main.db");
        configFile = tempDir.resolve("feedsim.toml");
        Files.writeString(configFile, String.join("\n",
                "[database]",
                "path = '" + dbFile.toAbsolutePath().toString().replace('\\', '/') + "'",
                "",
                "[run]",
                "num-agents = 2",
                "num-turns = 2",
                ""));

        SqliteDatabase database = new SqliteDatabase(dbFile);
        ProfileRepository profiles = new ProfileRepository(new SqlProfileAdapter(database));
        profiles.createOrUpdateProfile(new Profile("dora", "did:plc:dora", "Dora", "", 0, 0, 1));
        profiles.createOrUpdateProfile(new Profile("eli", "did:plc:eli", "Eli", "", 0, 0, 1));
        new FeedPostRepository(new SqlFeedPostAdapter(database)).createOrUpdateFeedPosts(List.of(
                new FeedPost("at://dora/1", "Dora", "dora", "hi", 0, 0, 0, 0, 0, Instant.ofEpochSecond(1)),
                new FeedPost("at://eli/1", "Eli", "eli", "hey", 0, 0, 0, 0, 0, Instant.ofEpochSecond(2))));

        output = new ByteArrayOutputStream();
        out = new PrintStream(output, true, StandardCharsets.UTF_8);
    }

    @Test
    void run_shouldExecuteRunAndPrintTurns() {
        int exitCode = SimulationMain.run(new String[] { "--config", configFile.toString() }, out);

        String printed = printed();
        assertEquals(0, exitCode, printed);
        assertTrue(printed.contains("completed (2 agents, 2 turns)"), printed);
        assertTrue(printed.contains("turn 0: likes=0"), printed);
        assertTrue(printed.contains("turn 1: likes=0"), printed);
    }

    @Test
    void run_shouldListRunsAfterExecution() {
        assertEquals(0, SimulationMain.run(new String[] { "--config", configFile.toString(), "--turns", "1" }, out));
        output.reset();

        assertEquals(0, SimulationMain.run(new String[] { "--config", configFile.toString(), "--list" }, out));
        assertTrue(printed().contains("completed"), printed());
        assertTrue(printed().contains("turns=1"), printed());
    }

    @Test
    void run_shouldFailWhenMoreAgentsThanProfiles() {
        int exitCode = SimulationMain.run(new String[] { "--config", configFile.toString(), "--agents", "5" }, out);

        assertEquals(1, exitCode);
        assertTrue(printed().contains("Simulation failed"), printed());
    }

    @Test
    void run_shouldRejectUnknownAlgorithm() {
        int exitCode = SimulationMain.run(new String[] { "--algorithm", "engagement" }, out);

        assertEquals(1, exitCode);
        assertTrue(printed().contains("engagement"), printed());
        assertTrue(printed().contains(SimulationMain.USAGE), printed());
    }

    @Test
    void run_shouldRejectMalformedArguments() {
        assertEquals(1, SimulationMain.run(new String[] { "--turns", "0" }, out));
        assertEquals(1, SimulationMain.run(new String[] { "--agents" }, out));
        assertEquals(1, SimulationMain.run(new String[] { "--verbose" }, out));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }
}
