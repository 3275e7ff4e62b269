package com.example.scan2doc.util.image;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileExtractedImageStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void savesAndFindsImagesByIdOnDisk() throws Exception {
        File dir = new File(tempDir.toFile(), "images");
        FileExtractedImageStore store = new FileExtractedImageStore(dir);

        store.save("page_0_abc", new byte[]{1, 2, 3});

        assertTrue(new File(dir, "page_0_abc.png").isFile());
        assertArrayEquals(new byte[]{1, 2, 3}, store.find("page_0_abc"));
        assertNull(store.find("missing"));
        assertNull(store.find("../escape"));
    }
}
