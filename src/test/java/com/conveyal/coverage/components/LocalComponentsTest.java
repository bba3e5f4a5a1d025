package com.conveyal.coverage.components;

import com.conveyal.coverage.CoverageConfig;
import com.conveyal.coverage.TestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class LocalComponentsTest {

    @TempDir
    Path tempDir;

    private CoverageConfig config;

    @BeforeEach
    void setUp () throws Exception {
        Files.copy(Path.of("collections.json"), tempDir.resolve("collections.json"));
        config = TestConfig.config(tempDir);
    }

    @Test
    void wiresEveryComponent () {
        Components components = new LocalComponents(config);
        try {
            assertNotNull(components.jobRunner);
            assertNotNull(components.pipeline);
            assertEquals(1, components.catalog.list().size());
        } finally {
            components.shutdown();
        }
    }

    @Test
    void registeredProcessesSurviveRestart () {
        Components first = new LocalComponents(config);
        try {
            first.registry.register("ndvi", List.of("B04", "B08"), Map.of("ndvi", "(B08 - B04) / (B08 + B04)"));
        } finally {
            first.shutdown();
        }
        Components second = new LocalComponents(config);
        try {
            assertEquals(Set.of("ndvi"), second.registry.processIds());
        } finally {
            second.shutdown();
        }
    }

}
