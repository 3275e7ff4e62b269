package com.example.scan2doc.util.pdf;

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLConnection;
import java.nio.file.Files;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 字体字节加载（带重试与缓存）
 *
 * 支持 http(s)、file: 地址以及不带协议的本地路径。
 * 失败时重试，第 i 次失败后等待 backoffMs × i 毫秒；全部失败返回 null，由调用方降级到标准字体。
 * 不存在的本地路径直接返回 null，不重试。
 * 成功的结果按地址缓存，进程内只下载一次。
 */
@Slf4j
public class FontLoader {

    public static final int DEFAULT_RETRIES = 3;
    public static final long DEFAULT_BACKOFF_MS = 500;

    private static final int TIMEOUT_MS = 15000;

    private final int retries;
    private final long backoffMs;
    private final Map<String, byte[]> cache = new ConcurrentHashMap<>();

    public FontLoader() {
        this(DEFAULT_RETRIES, DEFAULT_BACKOFF_MS);
    }

    public FontLoader(int retries, long backoffMs) {
        this.retries = Math.max(1, retries);
        this.backoffMs = Math.max(0, backoffMs);
    }

    /**
     * 获取字体字节
     *
     * @param url 字体地址
     * @return 字体字节；地址为空或多次尝试后仍失败时返回 null
     */
    public byte[] fetchFontBytes(String url) {
        if (url == null || url.trim().isEmpty()) {
            return null;
        }
        byte[] cached = cache.get(url);
        if (cached != null) {
            return cached;
        }

        // 本地文件不存在时重试没有意义
        if (isLocalPath(url) && !new File(url).isFile()) {
            log.warn("字体文件不存在: {}", url);
            return null;
        }

        for (int attempt = 1; attempt <= retries; attempt++) {
            try {
                byte[] bytes = read(url);
                cache.put(url, bytes);
                log.info("字体加载成功: {} ({} 字节)", url, bytes.length);
                return bytes;
            } catch (IOException e) {
                if (attempt == retries) {
                    log.warn("字体加载失败（已尝试 {} 次）: {} - {}", retries, url, e.getMessage());
                    return null;
                }
                log.debug("字体加载失败，第 {} 次重试: {}", attempt, e.getMessage());
                try {
                    Thread.sleep(backoffMs * attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return null;
                }
            }
        }
        return null;
    }

    private static boolean isLocalPath(String url) {
        return !url.contains(":/") && !url.startsWith("file:");
    }

    private byte[] read(String url) throws IOException {
        if (isLocalPath(url)) {
            return Files.readAllBytes(new File(url).toPath());
        }

        URLConnection connection = new URL(url).openConnection();
        connection.setConnectTimeout(TIMEOUT_MS);
        connection.setReadTimeout(TIMEOUT_MS);
        try {
            if (connection instanceof HttpURLConnection) {
                int code = ((HttpURLConnection) connection).getResponseCode();
                if (code != HttpURLConnection.HTTP_OK) {
                    throw new IOException("Failed to fetch font: HTTP " + code);
                }
            }
            try (InputStream in = connection.getInputStream();
                 ByteArrayOutputStream out = new ByteArrayOutputStream()) {
                byte[] buffer = new byte[8192];
                int n;
                while ((n = in.read(buffer)) != -1) {
                    out.write(buffer, 0, n);
                }
                return out.toByteArray();
            }
        } finally {
            if (connection instanceof HttpURLConnection) {
                ((HttpURLConnection) connection).disconnect();
            }
        }
    }
}
