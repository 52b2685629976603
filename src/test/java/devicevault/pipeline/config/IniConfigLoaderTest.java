package devicevault.pipeline.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class IniConfigLoaderTest {

    private static Path resource(String name) throws Exception {
        return Path.of(IniConfigLoaderTest.class.getResource("/" + name).toURI());
    }

    @Test
    void overridesOnlyWhatTheFileSets() throws Exception {
        PipelineConfig config = IniConfigLoader.load(resource("scheduler-test.ini"));

        assertEquals("jdbc:h2:mem:ini-test", config.databaseUrl());
        assertEquals(3, config.databasePoolSize());
        assertEquals("redis://cache.example:6380/2", config.redisUrl());
        assertFalse(config.schedulerEnabled());
        assertEquals(Duration.ofMinutes(30), config.restartWindow());
        assertEquals(ZoneId.of("Australia/Sydney"), config.displayTimezone());
        assertEquals(Duration.ofSeconds(90), config.lockTtl());
        assertEquals("results:test", config.collectionResultsStream());
        assertEquals(5, config.streamReadCount());
        assertEquals("collector.default", config.defaultCollectorQueue());
        assertEquals(Duration.ofSeconds(15), config.retrievalTimeout());
        assertEquals(9090, config.serverPort());

        // untouched keys keep their defaults
        assertEquals("devicevault", config.collectionResultsGroup());
        assertEquals("storage:results", config.storageResultsStream());
        assertEquals(Duration.ofSeconds(60), config.tickInterval());
        assertEquals(":dead", config.deadLetterSuffix());
        assertEquals("0.0.0.0", config.serverHost());
    }

    @Test
    void missingFileMeansDefaults(@TempDir Path dir) {
        PipelineConfig config = IniConfigLoader.load(dir.resolve("absent.ini"));

        assertTrue(config.schedulerEnabled());
        assertEquals(Duration.ofMinutes(120), config.restartWindow());
        assertEquals(8080, config.serverPort());
    }

    @Test
    void invalidNumberIsRejected(@TempDir Path dir) throws Exception {
        Path ini = dir.resolve("bad.ini");
        Files.writeString(ini, "[server]\nport = eighty\n");

        assertThrows(NumberFormatException.class, () -> IniConfigLoader.load(ini));
    }
}
