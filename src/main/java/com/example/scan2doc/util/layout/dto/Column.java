package com.example.scan2doc.util.layout.dto;

import com.example.scan2doc.util.ocr.dto.ParsedBlock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 视觉行中的一列（不可变）
 *
 * 同一列的块自上而下连续阅读；横向范围 [left, right] 为所有块的外包区间。
 */
public final class Column {

    private final List<ParsedBlock> blocks;
    private final double left;
    private final double right;

    private Column(List<ParsedBlock> blocks, double left, double right) {
        this.blocks = Collections.unmodifiableList(blocks);
        this.left = left;
        this.right = right;
    }

    /**
     * 以单个块开一列
     */
    public static Column of(ParsedBlock block) {
        List<ParsedBlock> list = new ArrayList<>();
        list.add(block);
        return new Column(list, block.left(), block.right());
    }

    /**
     * 追加一个块，返回横向范围扩展后的新列
     */
    public Column with(ParsedBlock block) {
        List<ParsedBlock> list = new ArrayList<>(blocks);
        list.add(block);
        return new Column(list, Math.min(left, block.left()), Math.max(right, block.right()));
    }

    /**
     * 块按上边沿排序后的新列
     */
    public Column sortedByTop() {
        List<ParsedBlock> list = new ArrayList<>(blocks);
        list.sort(Comparator.comparingDouble(ParsedBlock::top));
        return new Column(list, left, right);
    }

    /**
     * 与给定块的横向重叠长度（无重叠为 0）
     */
    public double horizontalOverlap(ParsedBlock block) {
        return Math.max(0, Math.min(right, block.right()) - Math.max(left, block.left()));
    }

    public List<ParsedBlock> getBlocks() {
        return blocks;
    }

    public double getLeft() {
        return left;
    }

    public double getRight() {
        return right;
    }

    public double getWidth() {
        return right - left;
    }

    public double getCenterX() {
        return (left + right) / 2;
    }

    @Override
    public String toString() {
        return String.format("Column{left=%.1f, right=%.1f, blocks=%d}", left, right, blocks.size());
    }
}
