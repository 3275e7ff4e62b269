package com.example.scan2doc.util.image;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存切图存储，测试用
 */
public class InMemoryExtractedImageStore implements ExtractedImageStore {

    private final Map<String, byte[]> images = new ConcurrentHashMap<>();

    @Override
    public void save(String imageId, byte[] png) {
        images.put(imageId, png.clone());
    }

    @Override
    public byte[] find(String imageId) {
        byte[] png = imageId != null ? images.get(imageId) : null;
        return png != null ? png.clone() : null;
    }

    public int size() {
        return images.size();
    }
}
