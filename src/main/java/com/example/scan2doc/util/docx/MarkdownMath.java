package com.example.scan2doc.util.docx;

import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Node;
import org.commonmark.node.Paragraph;
import org.commonmark.node.Text;
import org.commonmark.parser.Parser;
import org.commonmark.parser.PostProcessor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * commonmark 的公式扩展
 *
 * 处理方式：
 * 1. 解析前把 $$...$$ 与 $...$ 替换为私有区字符包裹的占位符（U+E000 序号 U+E001），
 *    公式内容不会被 * _ 等 Markdown 语法误解析
 * 2. 解析后由 {@link PostProcessor} 把文本节点中的占位符拆成 {@link MathInline}
 * 3. 段落只包含一个 $$ 公式时整段替换为 {@link MathBlock}
 *
 * HTML 块等字面量中的占位符通过 {@link #restore(String)} 还原。
 * 每次解析新建一个实例。
 */
public final class MarkdownMath {

    static final char OPEN = '\uE000';
    static final char CLOSE = '\uE001';

    private static final Pattern BLOCK = Pattern.compile("\\$\\$([\\s\\S]+?)\\$\\$");
    private static final Pattern INLINE = Pattern.compile("(?<![\\\\$])\\$(?![\\s$])([^$\\n]+?)(?<!\\s)\\$(?!\\d)");
    private static final Pattern PLACEHOLDER = Pattern.compile(OPEN + "(\\d+)" + CLOSE);

    private final List<String> formulas = new ArrayList<>();
    private final List<Boolean> displays = new ArrayList<>();
    private final String protectedText;

    private MarkdownMath(String markdown) {
        this.protectedText = protect(markdown);
    }

    /**
     * 提取 Markdown 中的公式
     */
    public static MarkdownMath extract(String markdown) {
        return new MarkdownMath(markdown == null ? "" : markdown);
    }

    /**
     * 解析为 commonmark 语法树（公式已转为 MathInline / MathBlock 节点）
     */
    public Node parse() {
        Parser parser = Parser.builder()
                .postProcessor(new MathPostProcessor())
                .build();
        return parser.parse(protectedText);
    }

    /**
     * 占位符还原为原始 $...$ / $$...$$
     */
    public String restore(String text) {
        if (text == null || text.indexOf(OPEN) < 0) {
            return text;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuffer sb = new StringBuffer();
        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1));
            String delimiter = displays.get(index) ? "$$" : "$";
            matcher.appendReplacement(sb, Matcher.quoteReplacement(delimiter + formulas.get(index) + delimiter));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    String getProtectedText() {
        return protectedText;
    }

    private String protect(String markdown) {
        StringBuffer sb = new StringBuffer();
        Matcher block = BLOCK.matcher(markdown);
        while (block.find()) {
            String placeholder = register(block.group(1).trim(), true);
            // 独占一行的 $$ 公式强制单独成段
            boolean lineStart = block.start() == 0 || markdown.charAt(block.start() - 1) == '\n';
            boolean lineEnd = block.end() == markdown.length() || markdown.charAt(block.end()) == '\n';
            if (lineStart && lineEnd) {
                placeholder = "\n\n" + placeholder + "\n\n";
            }
            block.appendReplacement(sb, Matcher.quoteReplacement(placeholder));
        }
        block.appendTail(sb);

        String withoutBlocks = sb.toString();
        sb = new StringBuffer();
        Matcher inline = INLINE.matcher(withoutBlocks);
        while (inline.find()) {
            inline.appendReplacement(sb, Matcher.quoteReplacement(register(inline.group(1), false)));
        }
        inline.appendTail(sb);
        return sb.toString();
    }

    private String register(String latex, boolean display) {
        formulas.add(latex);
        displays.add(display);
        return OPEN + String.valueOf(formulas.size() - 1) + CLOSE;
    }

    /**
     * 文本节点中的占位符 → MathInline；只含一个 $$ 公式的段落 → MathBlock
     */
    private class MathPostProcessor implements PostProcessor {

        @Override
        public Node process(Node document) {
            List<Text> texts = new ArrayList<>();
            document.accept(new AbstractVisitor() {
                @Override
                public void visit(Text text) {
                    if (text.getLiteral().indexOf(OPEN) >= 0) {
                        texts.add(text);
                    }
                }
            });

            for (Text text : texts) {
                splitText(text);
            }

            List<Paragraph> paragraphs = new ArrayList<>();
            document.accept(new AbstractVisitor() {
                @Override
                public void visit(Paragraph paragraph) {
                    paragraphs.add(paragraph);
                }
            });
            for (Paragraph paragraph : paragraphs) {
                Node only = paragraph.getFirstChild();
                if (only instanceof MathInline && only.getNext() == null && ((MathInline) only).isDisplay()) {
                    paragraph.insertBefore(new MathBlock(((MathInline) only).getLatex()));
                    paragraph.unlink();
                }
            }
            return document;
        }

        private void splitText(Text text) {
            String literal = text.getLiteral();
            Matcher matcher = PLACEHOLDER.matcher(literal);
            int last = 0;
            while (matcher.find()) {
                if (matcher.start() > last) {
                    text.insertBefore(new Text(literal.substring(last, matcher.start())));
                }
                int index = Integer.parseInt(matcher.group(1));
                text.insertBefore(new MathInline(formulas.get(index), displays.get(index)));
                last = matcher.end();
            }
            if (last < literal.length()) {
                text.insertBefore(new Text(literal.substring(last)));
            }
            text.unlink();
        }
    }
}
