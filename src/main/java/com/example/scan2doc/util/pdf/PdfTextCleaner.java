package com.example.scan2doc.util.pdf;

import com.example.scan2doc.util.latex.LatexToUnicodeConverter;
import com.example.scan2doc.util.ocr.dto.ParsedBlock;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 隐藏文字层的文本清洗
 *
 * 表格：行 → 换行，单元格 → 两个空格，去标签并解码实体。
 * 普通文本：去 Markdown 标题符号、图片与链接，压缩空白，公式转 Unicode。
 */
public final class PdfTextCleaner {

    private static final Pattern ROW_END = Pattern.compile("</tr>", Pattern.CASE_INSENSITIVE);
    private static final Pattern CELL_END = Pattern.compile("</t[dh]>", Pattern.CASE_INSENSITIVE);
    private static final Pattern BR = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]*>");

    private static final Pattern HEADING_MARK = Pattern.compile("^#+\\s*", Pattern.MULTILINE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern PAREN_MATH = Pattern.compile("\\\\\\((.*?)\\\\\\)");
    private static final Pattern BRACKET_MATH = Pattern.compile("\\\\\\[(.*?)\\\\]");
    private static final Pattern DISPLAY_DOLLAR = Pattern.compile("\\$\\$(.+?)\\$\\$");
    private static final Pattern INLINE_DOLLAR = Pattern.compile("(?<![\\\\$])\\$(?![\\s$])([^$]+?)(?<!\\s)\\$(?!\\d)");

    private PdfTextCleaner() {
    }

    /**
     * 块 → 文字层文本（表格类型或内容含 &lt;table 时按表格处理）
     */
    public static String textFor(ParsedBlock block) {
        if ("table".equals(block.getType()) || block.getContent().contains("<table")) {
            return cleanTableHtml(block.getContent());
        }
        return cleanText(block.getContent());
    }

    /**
     * 示例：
     * 输入：&lt;table&gt;&lt;tr&gt;&lt;td&gt;A&lt;/td&gt;&lt;td&gt;B&amp;amp;C&lt;/td&gt;&lt;/tr&gt;&lt;tr&gt;&lt;td&gt;1&lt;/td&gt;&lt;/tr&gt;&lt;/table&gt;
     * 输出："A  B&amp;C\n1"
     */
    public static String cleanTableHtml(String html) {
        String text = ROW_END.matcher(html).replaceAll("\n");
        text = CELL_END.matcher(text).replaceAll("  ");
        // 单元格内的换行用空格，避免打乱行结构
        text = BR.matcher(text).replaceAll(" ");
        text = TAG.matcher(text).replaceAll("");
        text = Parser.unescapeEntities(text, false).replace('\u00A0', ' ');

        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return String.join("\n", lines);
    }

    /**
     * 示例：
     * 输入："## 温度 \(100^{\circ}\mathrm{C}\) ![Figure](a.png)"
     * 输出："温度 100°C"
     */
    public static String cleanText(String content) {
        String text = HEADING_MARK.matcher(content).replaceAll("");
        text = removeMarkdownLinks(text, true);
        text = removeMarkdownLinks(text, false);
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();

        text = convertMath(PAREN_MATH, text);
        text = convertMath(BRACKET_MATH, text);
        text = convertMath(DISPLAY_DOLLAR, text);
        text = convertMath(INLINE_DOLLAR, text);
        return text;
    }

    private static String convertMath(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        StringBuffer sb = new StringBuffer();
        while (matcher.find()) {
            String unicode = LatexToUnicodeConverter.convert(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(unicode));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * 去掉 ![..](..) 或 [..](..)；方括号后不紧跟圆括号的保留
     */
    static String removeMarkdownLinks(String text, boolean image) {
        String prefix = image ? "![" : "[";
        String result = text;
        int start = result.indexOf(prefix);
        while (start != -1) {
            int bracketEnd = result.indexOf(']', start);
            if (bracketEnd == -1) {
                break;
            }
            if (bracketEnd + 1 < result.length() && result.charAt(bracketEnd + 1) == '(') {
                int parenEnd = result.indexOf(')', bracketEnd + 1);
                if (parenEnd == -1) {
                    break;
                }
                result = result.substring(0, start) + result.substring(parenEnd + 1);
                start = result.indexOf(prefix);
            } else {
                start = result.indexOf(prefix, start + 1);
            }
        }
        return result;
    }
}
