package com.example.scan2doc.util.layout;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LayoutConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileFallsBackToDefaults() {
        LayoutConfig config = LayoutConfig.loadFromJson(new File(tempDir.toFile(), "absent.json").getPath());

        assertEquals(20.0, config.BOX_MATCH_TOLERANCE_PX);
        assertEquals(0.3, config.COLUMN_OVERLAP_RATIO);
        assertEquals(1000.0, LayoutConfig.loadFromJson("").DEFAULT_PAGE_WIDTH);
    }

    @Test
    void partialJsonOverridesOnlyGivenKeys() throws Exception {
        Path file = tempDir.resolve("layout.json");
        Files.write(file, "{\"CAPTION_GAP_MAX\": 150, \"COLUMN_OVERLAP_RATIO\": 0.5}".getBytes(StandardCharsets.UTF_8));

        LayoutConfig config = LayoutConfig.loadFromJson(file.toString());

        assertEquals(150.0, config.CAPTION_GAP_MAX);
        assertEquals(0.5, config.COLUMN_OVERLAP_RATIO);
        assertEquals(-10.0, config.CAPTION_GAP_MIN);
        assertEquals(0.05, config.BOX_MATCH_TOLERANCE_RATIO);
    }

    @Test
    void malformedJsonFallsBackToDefaults() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.write(file, "{not json".getBytes(StandardCharsets.UTF_8));

        assertEquals(100.0, LayoutConfig.loadFromJson(file.toString()).CAPTION_GAP_MAX);
    }
}
