package com.conveyal.coverage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoverageMainTest {

    @TempDir
    Path tempDir;

    private String configFile;

    @BeforeEach
    void setUp () throws Exception {
        Files.copy(Path.of("collections.json"), tempDir.resolve("collections.json"));
        Path properties = tempDir.resolve("test.properties");
        try (OutputStream out = new FileOutputStream(properties.toFile())) {
            TestConfig.properties(tempDir).store(out, null);
        }
        configFile = properties.toString();
    }

    private Path storedProcess (String id) {
        return tempDir.resolve("cache").resolve("processes").resolve(id + ".json");
    }

    @Test
    void helpAndUsageErrors () {
        assertEquals(0, CoverageMain.execute("-h"));
        assertEquals(2, CoverageMain.execute());
        assertEquals(2, CoverageMain.execute("--no-such-option"));
    }

    @Test
    void registersProcessFromFile () throws Exception {
        assertEquals(0, CoverageMain.execute("-c", configFile, "-r", "examples/ndvi-process.json"));
        assertTrue(Files.exists(storedProcess("ndvi")));
        String stored = Files.readString(storedProcess("ndvi"), StandardCharsets.UTF_8);
        assertTrue(stored.contains("sentinel-2-l2a"));
    }

    @Test
    void invalidDefinitionIsNotStored () throws Exception {
        Path definition = tempDir.resolve("cyclic.json");
        Files.writeString(definition,
                "{\"id\": \"cyclic\", \"sourceBands\": [\"B04\"], \"bandFunctions\": {\"a\": \"b\", \"b\": \"a\"}}");
        assertEquals(1, CoverageMain.execute("-c", configFile, "-r", definition.toString()));
        assertFalse(Files.exists(storedProcess("cyclic")));
    }

    @Test
    void badRunOptionsAreUsageErrors () {
        String subset = "lon(16:16.1),lat(48:48.1)";
        assertEquals(2, CoverageMain.execute("-c", configFile, "-p", "ndvi"));
        assertEquals(2, CoverageMain.execute("-c", configFile, "-p", "ndvi", "-s", "lon(16:16.1)"));
        assertEquals(2, CoverageMain.execute("-c", configFile, "-p", "ndvi", "-s", subset, "-W", "10"));
        assertEquals(2, CoverageMain.execute("-c", configFile, "-p", "ndvi", "-s", subset, "-W", "ten", "-H", "10"));
        assertEquals(2, CoverageMain.execute("-c", configFile, "-p", "ndvi", "-s", subset, "-W", "0", "-H", "10"));
    }

    @Test
    void failedJobGivesNonZeroExit () {
        assertEquals(1, CoverageMain.execute("-c", configFile, "-p", "unknown", "-s", "lon(16:16.1),lat(48:48.1)"));
    }

}
