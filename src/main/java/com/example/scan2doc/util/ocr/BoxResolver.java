package com.example.scan2doc.util.ocr;

import com.example.scan2doc.util.layout.LayoutConfig;
import com.example.scan2doc.util.ocr.dto.ImageDims;
import com.example.scan2doc.util.ocr.dto.OcrBox;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 检测框解析器：把 raw_text 中的（可能 0~1000 归一化的）坐标映射到权威像素坐标
 *
 * 匹配规则：
 * 1. 候选坐标：原样坐标、按 0~1000 缩放到像素后的坐标（依次尝试）
 * 2. 每个候选与所有未占用的权威框逐一比较，四条边分别在容差内即视为匹配
 * 3. 第一个匹配的权威框被占用，同一个权威框不会分配给两个块
 * 4. 全部不匹配时退回 {@link #normalize(double[], ImageDims, double)}
 *
 * 容差：每个轴取 max(绝对像素容差, 比例 × 对应图像边长)，Markdown 与 PDF 两条链路使用同一策略。
 *
 * 占用状态只属于当前实例：每条流水线各自 new 一个。
 */
public class BoxResolver {

    private final List<OcrBox> boxes;
    private final ImageDims dims;
    private final LayoutConfig config;
    private final Set<Integer> usedBoxIndices = new HashSet<>();

    /**
     * 最近一次 {@link #resolve(double[])} 命中的权威框下标，未命中为 -1
     */
    private int lastMatchIndex = -1;

    public BoxResolver(List<OcrBox> boxes, ImageDims dims, LayoutConfig config) {
        this.boxes = boxes != null ? boxes : Collections.<OcrBox>emptyList();
        this.dims = dims;
        this.config = config != null ? config : LayoutConfig.loadDefault();
    }

    /**
     * 解析块坐标
     *
     * @param rawCoords raw_text 中的坐标 [x1, y1, x2, y2]
     * @return 像素坐标（命中权威框时为权威框坐标的副本）
     */
    public double[] resolve(double[] rawCoords) {
        lastMatchIndex = findMatchingBoxIndex(rawCoords);
        if (lastMatchIndex != -1) {
            usedBoxIndices.add(lastMatchIndex);
            return boxes.get(lastMatchIndex).getBox().clone();
        }
        return normalize(rawCoords, dims, config.NORMALIZED_SCALE);
    }

    /**
     * 最近一次解析命中的权威框下标（用于查找切图结果），未命中为 -1
     */
    public int getLastMatchIndex() {
        return lastMatchIndex;
    }

    /**
     * 查找匹配的权威框下标（不占用）
     */
    public int findMatchingBoxIndex(double[] rawCoords) {
        if (boxes.isEmpty() || rawCoords == null || rawCoords.length != 4) {
            return -1;
        }

        double toleranceX = tolerance(dims != null ? dims.getW() : 0);
        double toleranceY = tolerance(dims != null ? dims.getH() : 0);

        for (double[] candidate : candidates(rawCoords)) {
            for (int i = 0; i < boxes.size(); i++) {
                if (usedBoxIndices.contains(i)) {
                    continue;
                }
                OcrBox box = boxes.get(i);
                if (box == null || box.getBox() == null || box.getBox().length != 4) {
                    continue;
                }
                if (isBoxMatching(box.getBox(), candidate, toleranceX, toleranceY)) {
                    return i;
                }
            }
        }
        return -1;
    }

    private double tolerance(double dimension) {
        return Math.max(config.BOX_MATCH_TOLERANCE_PX, dimension * config.BOX_MATCH_TOLERANCE_RATIO);
    }

    private List<double[]> candidates(double[] rawCoords) {
        List<double[]> result = new ArrayList<>();
        result.add(rawCoords);
        if (dims != null && dims.getW() > 0 && dims.getH() > 0) {
            result.add(scale(rawCoords, dims, config.NORMALIZED_SCALE));
        }
        return result;
    }

    private static boolean isBoxMatching(double[] box, double[] coords, double toleranceX, double toleranceY) {
        return Math.abs(box[0] - coords[0]) <= toleranceX &&
                Math.abs(box[1] - coords[1]) <= toleranceY &&
                Math.abs(box[2] - coords[2]) <= toleranceX &&
                Math.abs(box[3] - coords[3]) <= toleranceY;
    }

    private static double[] scale(double[] coords, ImageDims dims, double normalizedScale) {
        return new double[]{
                coords[0] / normalizedScale * dims.getW(),
                coords[1] / normalizedScale * dims.getH(),
                coords[2] / normalizedScale * dims.getW(),
                coords[3] / normalizedScale * dims.getH()
        };
    }

    /**
     * 坐标归一化：最大坐标 ≤ 1000 且图像任一边 > 1000 像素时，认为是 0~1000 归一化坐标并缩放到像素
     *
     * 示例：
     * 输入：[100, 200, 500, 400]，图像 2000x3000
     * 输出：[200, 600, 1000, 1200]
     *
     * @param coords 原始坐标
     * @param dims 图像尺寸（为 null 时原样返回）
     * @return 像素坐标
     */
    public static double[] normalize(double[] coords, ImageDims dims) {
        return normalize(coords, dims, 1000.0);
    }

    static double[] normalize(double[] coords, ImageDims dims, double normalizedScale) {
        if (coords == null || coords.length < 4) {
            return new double[4];
        }
        if (dims == null) {
            return coords.clone();
        }

        double maxCoord = Math.max(Math.max(coords[0], coords[1]), Math.max(coords[2], coords[3]));
        if (maxCoord <= normalizedScale && (dims.getW() > normalizedScale || dims.getH() > normalizedScale)) {
            return scale(coords, dims, normalizedScale);
        }
        return coords.clone();
    }
}
