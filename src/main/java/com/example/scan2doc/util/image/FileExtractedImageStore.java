package com.example.scan2doc.util.image;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

/**
 * 文件切图存储：每张图保存为 {baseDir}/{imageId}.png
 */
@Slf4j
public class FileExtractedImageStore implements ExtractedImageStore {

    private final File baseDir;

    public FileExtractedImageStore(File baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public void save(String imageId, byte[] png) throws IOException {
        if (!baseDir.exists() && !baseDir.mkdirs()) {
            throw new IOException("无法创建切图目录: " + baseDir.getAbsolutePath());
        }
        Files.write(fileOf(imageId).toPath(), png);
    }

    @Override
    public byte[] find(String imageId) {
        if (imageId == null || !imageId.matches("[a-zA-Z0-9_-]+")) {
            return null;
        }
        File file = fileOf(imageId);
        if (!file.isFile()) {
            return null;
        }
        try {
            return Files.readAllBytes(file.toPath());
        } catch (IOException e) {
            log.warn("读取切图失败: {}", file.getAbsolutePath(), e);
            return null;
        }
    }

    private File fileOf(String imageId) {
        return new File(baseDir, imageId + ".png");
    }
}
