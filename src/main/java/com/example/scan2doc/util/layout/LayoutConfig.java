package com.example.scan2doc.util.layout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.File;

/**
 * 版面还原全局配置类
 *
 * 设计原则：
 * 1. 硬编码默认值（开箱即用）
 * 2. 支持从 JSON 文件部分覆盖
 * 3. 容错回退（JSON 解析失败时使用默认值）
 *
 * 阈值均为经验值，需要用真实扫描页样本校准。
 */
@Slf4j
public class LayoutConfig {

    // ========== 坐标匹配 ==========

    /** 检测框匹配绝对容差（像素） */
    public double BOX_MATCH_TOLERANCE_PX = 20.0;

    /** 检测框匹配相对容差（占图像宽/高的比例） */
    public double BOX_MATCH_TOLERANCE_RATIO = 0.05;

    /** 归一化坐标的刻度（0~1000） */
    public double NORMALIZED_SCALE = 1000.0;

    // ========== 图注绑定 ==========

    /** 图注顶部相对图片底部的最小间距（允许少量重叠，像素） */
    public double CAPTION_GAP_MIN = -10.0;

    /** 图注顶部相对图片底部的最大间距（像素） */
    public double CAPTION_GAP_MAX = 100.0;

    /** 图注中心点超出图片左右边界的容差（像素） */
    public double CAPTION_ALIGN_SLACK = 50.0;

    // ========== 分栏 ==========

    /** 归入同一栏所需的水平重叠比例（相对较窄者宽度） */
    public double COLUMN_OVERLAP_RATIO = 0.3;

    /** 页面宽度缺失时的默认宽度（像素） */
    public double DEFAULT_PAGE_WIDTH = 1000.0;

    private LayoutConfig() {
    }

    /**
     * 加载默认配置
     */
    public static LayoutConfig loadDefault() {
        return new LayoutConfig();
    }

    /**
     * 从 JSON 文件加载配置（部分覆盖）
     *
     * @param jsonPath JSON 配置文件路径
     * @return 配置对象（失败时返回默认配置）
     */
    public static LayoutConfig loadFromJson(String jsonPath) {
        LayoutConfig config = new LayoutConfig();
        if (jsonPath == null || jsonPath.trim().isEmpty()) {
            return config;
        }

        File file = new File(jsonPath);
        if (!file.exists()) {
            log.warn("[LayoutConfig] 配置文件不存在，使用默认配置: {}", jsonPath);
            return config;
        }

        try {
            ObjectMapper mapper = new ObjectMapper();
            JsonNode json = mapper.readTree(file);

            config.BOX_MATCH_TOLERANCE_PX = readDouble(json, "BOX_MATCH_TOLERANCE_PX", config.BOX_MATCH_TOLERANCE_PX);
            config.BOX_MATCH_TOLERANCE_RATIO = readDouble(json, "BOX_MATCH_TOLERANCE_RATIO", config.BOX_MATCH_TOLERANCE_RATIO);
            config.NORMALIZED_SCALE = readDouble(json, "NORMALIZED_SCALE", config.NORMALIZED_SCALE);
            config.CAPTION_GAP_MIN = readDouble(json, "CAPTION_GAP_MIN", config.CAPTION_GAP_MIN);
            config.CAPTION_GAP_MAX = readDouble(json, "CAPTION_GAP_MAX", config.CAPTION_GAP_MAX);
            config.CAPTION_ALIGN_SLACK = readDouble(json, "CAPTION_ALIGN_SLACK", config.CAPTION_ALIGN_SLACK);
            config.COLUMN_OVERLAP_RATIO = readDouble(json, "COLUMN_OVERLAP_RATIO", config.COLUMN_OVERLAP_RATIO);
            config.DEFAULT_PAGE_WIDTH = readDouble(json, "DEFAULT_PAGE_WIDTH", config.DEFAULT_PAGE_WIDTH);

            log.info("[LayoutConfig] Loaded config from: {}", jsonPath);

        } catch (Exception e) {
            log.warn("[LayoutConfig] Failed to load JSON, using default config: {}", e.getMessage());
            return new LayoutConfig();
        }

        return config;
    }

    private static double readDouble(JsonNode json, String key, double fallback) {
        return json.has(key) ? json.get(key).asDouble(fallback) : fallback;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("LayoutConfig{\n");
        sb.append("  BOX_MATCH_TOLERANCE_PX=").append(BOX_MATCH_TOLERANCE_PX).append(",\n");
        sb.append("  BOX_MATCH_TOLERANCE_RATIO=").append(BOX_MATCH_TOLERANCE_RATIO).append(",\n");
        sb.append("  CAPTION_GAP=[").append(CAPTION_GAP_MIN).append(", ").append(CAPTION_GAP_MAX).append("],\n");
        sb.append("  CAPTION_ALIGN_SLACK=").append(CAPTION_ALIGN_SLACK).append(",\n");
        sb.append("  COLUMN_OVERLAP_RATIO=").append(COLUMN_OVERLAP_RATIO).append("\n");
        sb.append("}");
        return sb.toString();
    }
}
