package com.example.scan2doc.util.pdf;

import com.example.scan2doc.util.ocr.dto.ParsedBlock;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 文字层的块修复
 *
 * 模型有时按 "表格框 → 标题框 → 表格内容" 的顺序输出标记，
 * 导致表格块为空、表格 HTML 落在紧随其后的标题块里。
 * 这里把 HTML 表格移回前面的空表格块，标题块只保留剩余文字。
 */
@Slf4j
public final class PdfBlockRepair {

    private static final Pattern TABLE_HTML = Pattern.compile("<table[\\s\\S]*?</table>");

    private PdfBlockRepair() {
    }

    /**
     * @param blocks 解析结果（不修改）
     * @return 修复后的新列表
     */
    public static List<ParsedBlock> reassignTables(List<ParsedBlock> blocks) {
        List<ParsedBlock> result = new ArrayList<>(blocks);
        for (int i = 0; i < result.size() - 1; i++) {
            ParsedBlock current = result.get(i);
            ParsedBlock next = result.get(i + 1);
            if (!"table".equals(current.getType()) || !current.getContent().trim().isEmpty()) {
                continue;
            }
            if (next.getContent() == null || !next.getContent().contains("<table")) {
                continue;
            }

            List<String> tables = new ArrayList<>();
            Matcher matcher = TABLE_HTML.matcher(next.getContent());
            while (matcher.find()) {
                tables.add(matcher.group());
            }
            if (tables.isEmpty()) {
                continue;
            }

            result.set(i, current.withContent(String.join("\n\n", tables)));
            result.set(i + 1, next.withContent(TABLE_HTML.matcher(next.getContent()).replaceAll("").trim()));
            log.debug("表格内容从块 #{} 移回块 #{}", next.getIndex(), current.getIndex());
        }
        return result;
    }
}
