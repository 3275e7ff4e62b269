package com.example.scan2doc.util.image;

import java.io.IOException;

/**
 * 切图存储
 *
 * 图片ID只包含 [a-zA-Z0-9_-]，Markdown 中以 scan2doc-img:ID 引用。
 */
public interface ExtractedImageStore {

    /**
     * 保存切图（PNG）
     */
    void save(String imageId, byte[] png) throws IOException;

    /**
     * 读取切图
     *
     * @return 图片字节，不存在时返回 null
     */
    byte[] find(String imageId);
}
