package com.example.scan2doc.util.layout.dto;

import java.util.Collections;
import java.util.List;

/**
 * 视觉行：纵向范围相互重叠的一组块，按列从左到右排列（不可变）
 */
public final class VisualRow {

    private final List<Column> columns;
    private final double top;
    private final double bottom;

    public VisualRow(List<Column> columns, double top, double bottom) {
        this.columns = Collections.unmodifiableList(columns);
        this.top = top;
        this.bottom = bottom;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public double getTop() {
        return top;
    }

    public double getBottom() {
        return bottom;
    }

    /**
     * 单列单块的行按普通段落输出，其余按版式表格输出
     */
    public boolean isSingleBlock() {
        return columns.size() == 1 && columns.get(0).getBlocks().size() == 1;
    }

    @Override
    public String toString() {
        return String.format("VisualRow{top=%.1f, bottom=%.1f, columns=%s}", top, bottom, columns);
    }
}
