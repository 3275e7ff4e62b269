package com.example.scan2doc.util.layout;

import com.example.scan2doc.util.layout.dto.Column;
import com.example.scan2doc.util.layout.dto.VisualRow;
import com.example.scan2doc.util.ocr.dto.ParsedBlock;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 扫描页版面分析器：块 → 视觉行 → 列
 *
 * 处理流程：
 * 1. 图注绑定：图片块下方紧邻、水平对齐的图注并入图片块
 * 2. 行划分：按上边沿排序，纵向区间相交的块归为一行（不动点扩展，行范围随新块加入而增长）
 * 3. 列聚类：行内按水平中心排序，水平重叠超过较窄者宽度一定比例的块归入同一列
 * 4. 排序：列内按上边沿、列按左边沿、行按上边沿
 *
 * 标题块（title / sub_title）和游离文本块始终独占一行，不参与分栏。
 *
 * 所有状态只存在于单次调用中，块本身不可变。
 */
@Slf4j
public class PageLayoutAnalyzer {

    private static final Comparator<ParsedBlock> BY_TOP = Comparator.comparingDouble(ParsedBlock::top);

    private final LayoutConfig config;

    public PageLayoutAnalyzer() {
        this(LayoutConfig.loadDefault());
    }

    public PageLayoutAnalyzer(LayoutConfig config) {
        this.config = config != null ? config : LayoutConfig.loadDefault();
    }

    /**
     * 分析版面
     *
     * @param blocks 坐标已解析的块（文档顺序）
     * @return 按上边沿排序的视觉行
     */
    public List<VisualRow> analyze(List<ParsedBlock> blocks) {
        List<ParsedBlock> bound = bindCaptions(blocks);

        // 过滤空块和零面积块
        List<ParsedBlock> valid = new ArrayList<>();
        for (ParsedBlock block : bound) {
            if ((!block.getContent().isEmpty() || block.isImage()) && block.hasArea()) {
                valid.add(block);
            }
        }
        if (valid.isEmpty()) {
            return new ArrayList<>();
        }

        valid.sort(BY_TOP);

        List<VisualRow> rows = new ArrayList<>();
        Set<Integer> assigned = new HashSet<>();

        for (int i = 0; i < valid.size(); i++) {
            if (assigned.contains(i)) {
                continue;
            }
            ParsedBlock seed = valid.get(i);
            assigned.add(i);

            if (standsAlone(seed)) {
                List<Column> columns = new ArrayList<>();
                columns.add(Column.of(seed));
                rows.add(new VisualRow(columns, seed.top(), seed.bottom()));
                continue;
            }

            List<ParsedBlock> rowBlocks = collectOverlapping(seed, valid, assigned);
            double rowTop = Double.MAX_VALUE;
            double rowBottom = -Double.MAX_VALUE;
            for (ParsedBlock block : rowBlocks) {
                rowTop = Math.min(rowTop, block.top());
                rowBottom = Math.max(rowBottom, block.bottom());
            }

            List<Column> columns = clusterIntoColumns(rowBlocks);
            if (!columns.isEmpty()) {
                rows.add(new VisualRow(columns, rowTop, rowBottom));
            }
        }

        rows.sort(Comparator.comparingDouble(VisualRow::getTop));
        log.debug("版面分析完成: {} 个块 → {} 行", valid.size(), rows.size());
        return rows;
    }

    /**
     * 图注绑定
     *
     * 块按上边沿排序后，每个图片块向后查找第一个满足以下条件的图注块：
     * - 类型为 image_caption / caption / figure_caption
     * - 图注顶部 - 图片底部 ∈ [CAPTION_GAP_MIN, CAPTION_GAP_MAX]
     * - 图注水平中心 ∈ [图片左 - CAPTION_ALIGN_SLACK, 图片右 + CAPTION_ALIGN_SLACK]
     * 命中后图注内容以 &lt;br/&gt; 拼接到图片内容之后，图片底边扩展到图注底边，图注块被移除。
     *
     * @param blocks 块列表
     * @return 按上边沿排序、图注已并入的块列表
     */
    public List<ParsedBlock> bindCaptions(List<ParsedBlock> blocks) {
        List<ParsedBlock> sorted = new ArrayList<>(blocks);
        sorted.sort(BY_TOP);

        List<ParsedBlock> result = new ArrayList<>();
        Set<Integer> consumed = new HashSet<>();

        for (int i = 0; i < sorted.size(); i++) {
            if (consumed.contains(i)) {
                continue;
            }
            ParsedBlock block = sorted.get(i);

            if (block.isImage()) {
                int captionIndex = findAdjacentCaption(block, sorted, i + 1, consumed);
                if (captionIndex != -1) {
                    ParsedBlock caption = sorted.get(captionIndex);
                    double[] box = block.getBox();
                    box[3] = Math.max(box[3], caption.bottom());
                    block = block.withContent(block.getContent() + "<br/>" + caption.getContent()).withBox(box);
                    consumed.add(captionIndex);
                    log.debug("图注绑定: {} ← {}", block, caption);
                }
            }
            result.add(block);
        }
        return result;
    }

    private int findAdjacentCaption(ParsedBlock image, List<ParsedBlock> sorted, int start, Set<Integer> consumed) {
        for (int j = start; j < sorted.size(); j++) {
            if (consumed.contains(j)) {
                continue;
            }
            ParsedBlock candidate = sorted.get(j);
            if (candidate.isCaption() && isVerticallyAdjacent(image, candidate) && isHorizontallyAligned(image, candidate)) {
                return j;
            }
        }
        return -1;
    }

    private boolean isVerticallyAdjacent(ParsedBlock image, ParsedBlock candidate) {
        double gap = candidate.top() - image.bottom();
        return gap >= config.CAPTION_GAP_MIN && gap <= config.CAPTION_GAP_MAX;
    }

    private boolean isHorizontallyAligned(ParsedBlock image, ParsedBlock candidate) {
        double centerX = candidate.centerX();
        return centerX >= image.left() - config.CAPTION_ALIGN_SLACK
                && centerX <= image.right() + config.CAPTION_ALIGN_SLACK;
    }

    /**
     * 标题块和游离文本块独占一行
     */
    private static boolean standsAlone(ParsedBlock block) {
        return block.isHeading() || block.isUntagged();
    }

    /**
     * 以 seed 为起点收集纵向相交的块（严格相交），直到没有新块加入
     */
    private List<ParsedBlock> collectOverlapping(ParsedBlock seed, List<ParsedBlock> sorted, Set<Integer> assigned) {
        double rowTop = seed.top();
        double rowBottom = seed.bottom();
        List<ParsedBlock> rowBlocks = new ArrayList<>();
        rowBlocks.add(seed);

        while (true) {
            int found = -1;
            for (int i = 0; i < sorted.size(); i++) {
                ParsedBlock block = sorted.get(i);
                if (assigned.contains(i) || standsAlone(block)) {
                    continue;
                }
                if (block.top() < rowBottom && block.bottom() > rowTop) {
                    found = i;
                    break;
                }
            }
            if (found == -1) {
                break;
            }

            ParsedBlock block = sorted.get(found);
            assigned.add(found);
            rowBlocks.add(block);
            rowTop = Math.min(rowTop, block.top());
            rowBottom = Math.max(rowBottom, block.bottom());
        }
        return rowBlocks;
    }

    /**
     * 行内列聚类：与现有列的水平重叠 > 较窄者宽度 × COLUMN_OVERLAP_RATIO 时并入重叠最大的列，否则新开一列
     */
    List<Column> clusterIntoColumns(List<ParsedBlock> rowBlocks) {
        List<ParsedBlock> sorted = new ArrayList<>(rowBlocks);
        sorted.sort(Comparator.comparingDouble(ParsedBlock::centerX));

        List<Column> columns = new ArrayList<>();
        for (ParsedBlock block : sorted) {
            int best = -1;
            double bestOverlap = 0;

            for (int c = 0; c < columns.size(); c++) {
                Column column = columns.get(c);
                double overlap = column.horizontalOverlap(block);
                double minWidth = Math.min(column.getWidth(), block.width());
                if (overlap > minWidth * config.COLUMN_OVERLAP_RATIO && overlap > bestOverlap) {
                    best = c;
                    bestOverlap = overlap;
                }
            }

            if (best != -1) {
                columns.set(best, columns.get(best).with(block));
            } else {
                columns.add(Column.of(block));
            }
        }

        List<Column> result = new ArrayList<>();
        for (Column column : columns) {
            result.add(column.sortedByTop());
        }
        result.sort(Comparator.comparingDouble(Column::getLeft));
        return result;
    }

    /**
     * 计算表格行各列宽度百分比
     *
     * 每列取 round(列宽 / 页宽 × 100)，再按总和重新归一到 100。
     *
     * 示例：
     * 页宽 1000，两列各宽 400 → [40, 40] → [50, 50]
     *
     * @param row 视觉行
     * @param pageWidth 页面宽度（像素）
     * @return 各列百分比（与列顺序一致）
     */
    public static List<Integer> columnWidthPercents(VisualRow row, double pageWidth) {
        List<Integer> raw = new ArrayList<>();
        int total = 0;
        for (Column column : row.getColumns()) {
            double w = Math.max(1, column.getWidth());
            int pct = (int) Math.round(w / pageWidth * 100);
            raw.add(pct);
            total += pct;
        }
        if (total <= 0) {
            return raw;
        }
        List<Integer> result = new ArrayList<>();
        for (int pct : raw) {
            result.add((int) Math.round((double) pct / total * 100));
        }
        return result;
    }
}
