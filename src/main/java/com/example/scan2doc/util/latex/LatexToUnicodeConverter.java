package com.example.scan2doc.util.latex;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 简单 LaTeX 公式 → 可读 Unicode 文本
 *
 * 用途：双层 PDF 文本层的复制粘贴体验，不是完整的数学公式解析器。
 * 无法识别的命令原样保留，不会删除内容。
 *
 * 示例：
 * <pre>
 * 100^{\circ}\mathrm{C}   → 100°C
 * x_{i}^{2}               → xi²
 * \frac{1}{2}             → (1)/(2)
 * \foo                    → \foo（未知命令原样保留）
 * </pre>
 */
public final class LatexToUnicodeConverter {

    /**
     * 符号直接替换表（按插入顺序替换，每个命令后面不能紧跟字母）
     */
    private static final Map<String, String> SYMBOL_MAP = new LinkedHashMap<>();

    private static final Map<Character, Character> SUPERSCRIPTS = new HashMap<>();

    private static final Map<String, Pattern> SYMBOL_PATTERNS = new LinkedHashMap<>();

    private static final Pattern WRAP_INLINE = Pattern.compile("^\\\\\\((.*)\\\\\\)$");
    private static final Pattern WRAP_DISPLAY = Pattern.compile("^\\\\\\[(.*)\\\\\\]$");
    private static final Pattern FORMAT_COMMAND =
            Pattern.compile("\\\\(mathrm|mathbf|mathit|text|textbf|mathbb)\\{([^{}]+)\\}");
    private static final Pattern SPACING = Pattern.compile("\\\\[,;]|\\\\[a-z]*quad");
    private static final Pattern SUBSCRIPT_GROUP = Pattern.compile("_\\{([^{}]+)\\}");
    private static final Pattern SUBSCRIPT_CHAR = Pattern.compile("_([0-9a-zA-Z])");
    private static final Pattern SUPERSCRIPT_GROUP = Pattern.compile("\\^\\{([^{}]+)\\}");
    private static final Pattern SUPERSCRIPT_CHAR = Pattern.compile("\\^([0-9+\\-=()ni])");
    private static final Pattern SUPERSCRIPT_RESULT = Pattern.compile("^[0-9+\\-=()ni⁰¹²³⁴⁵⁶⁷⁸⁹⁺⁻⁼⁽⁾ⁿⁱ]+$");
    private static final Pattern FRAC = Pattern.compile("\\\\frac\\{([^{}]+)\\}\\{([^{}]+)\\}");
    private static final Pattern SQRT = Pattern.compile("\\\\sqrt\\{([^{}]+)\\}");
    private static final Pattern BRACE_GROUP = Pattern.compile("\\{([^{}]+)\\}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static {
        // 单位 / 符号
        SYMBOL_MAP.put("\\circ", "°");
        SYMBOL_MAP.put("\\infty", "∞");
        SYMBOL_MAP.put("\\nabla", "∇");
        SYMBOL_MAP.put("\\partial", "∂");
        SYMBOL_MAP.put("\\%", "%");

        // 希腊字母（小写）
        SYMBOL_MAP.put("\\alpha", "α");
        SYMBOL_MAP.put("\\beta", "β");
        SYMBOL_MAP.put("\\gamma", "γ");
        SYMBOL_MAP.put("\\delta", "δ");
        SYMBOL_MAP.put("\\epsilon", "ε");
        SYMBOL_MAP.put("\\zeta", "ζ");
        SYMBOL_MAP.put("\\eta", "η");
        SYMBOL_MAP.put("\\theta", "θ");
        SYMBOL_MAP.put("\\iota", "ι");
        SYMBOL_MAP.put("\\kappa", "κ");
        SYMBOL_MAP.put("\\lambda", "λ");
        SYMBOL_MAP.put("\\mu", "μ");
        SYMBOL_MAP.put("\\nu", "ν");
        SYMBOL_MAP.put("\\xi", "ξ");
        SYMBOL_MAP.put("\\pi", "π");
        SYMBOL_MAP.put("\\rho", "ρ");
        SYMBOL_MAP.put("\\sigma", "σ");
        SYMBOL_MAP.put("\\tau", "τ");
        SYMBOL_MAP.put("\\upsilon", "υ");
        SYMBOL_MAP.put("\\phi", "φ");
        SYMBOL_MAP.put("\\chi", "χ");
        SYMBOL_MAP.put("\\psi", "ψ");
        SYMBOL_MAP.put("\\omega", "ω");

        // 希腊字母（大写）
        SYMBOL_MAP.put("\\Gamma", "Γ");
        SYMBOL_MAP.put("\\Delta", "Δ");
        SYMBOL_MAP.put("\\Theta", "Θ");
        SYMBOL_MAP.put("\\Lambda", "Λ");
        SYMBOL_MAP.put("\\Xi", "Ξ");
        SYMBOL_MAP.put("\\Pi", "Π");
        SYMBOL_MAP.put("\\Sigma", "Σ");
        SYMBOL_MAP.put("\\Upsilon", "Υ");
        SYMBOL_MAP.put("\\Phi", "Φ");
        SYMBOL_MAP.put("\\Psi", "Ψ");
        SYMBOL_MAP.put("\\Omega", "Ω");

        // 运算符与关系
        SYMBOL_MAP.put("\\times", "×");
        SYMBOL_MAP.put("\\cdot", "·");
        SYMBOL_MAP.put("\\div", "÷");
        SYMBOL_MAP.put("\\pm", "±");
        SYMBOL_MAP.put("\\mp", "∓");
        SYMBOL_MAP.put("\\le", "≤");
        SYMBOL_MAP.put("\\leq", "≤");
        SYMBOL_MAP.put("\\ge", "≥");
        SYMBOL_MAP.put("\\geq", "≥");
        SYMBOL_MAP.put("\\ne", "≠");
        SYMBOL_MAP.put("\\neq", "≠");
        SYMBOL_MAP.put("\\approx", "≈");
        SYMBOL_MAP.put("\\equiv", "≡");
        SYMBOL_MAP.put("\\sim", "∼");
        SYMBOL_MAP.put("\\forall", "∀");
        SYMBOL_MAP.put("\\exists", "∃");
        SYMBOL_MAP.put("\\in", "∈");
        SYMBOL_MAP.put("\\notin", "∉");
        SYMBOL_MAP.put("\\subset", "⊂");
        SYMBOL_MAP.put("\\supset", "⊃");
        SYMBOL_MAP.put("\\cup", "∪");
        SYMBOL_MAP.put("\\cap", "∩");
        SYMBOL_MAP.put("\\rightarrow", "→");
        SYMBOL_MAP.put("\\leftarrow", "←");
        SYMBOL_MAP.put("\\Rightarrow", "⇒");
        SYMBOL_MAP.put("\\Leftrightarrow", "⇔");

        // 其他
        SYMBOL_MAP.put("\\emptyset", "∅");
        SYMBOL_MAP.put("\\angle", "∠");

        for (String cmd : SYMBOL_MAP.keySet()) {
            SYMBOL_PATTERNS.put(cmd, Pattern.compile(Pattern.quote(cmd) + "(?![a-zA-Z])"));
        }

        String plain = "0123456789+-=()ni";
        String raised = "⁰¹²³⁴⁵⁶⁷⁸⁹⁺⁻⁼⁽⁾ⁿⁱ";
        for (int i = 0; i < plain.length(); i++) {
            SUPERSCRIPTS.put(plain.charAt(i), raised.charAt(i));
        }
    }

    private LatexToUnicodeConverter() {
    }

    /**
     * 转换 LaTeX 片段
     *
     * @param latex LaTeX 文本（可带 \( \) 或 \[ \] 外层定界符）
     * @return Unicode 文本，空白已折叠
     */
    public static String convert(String latex) {
        if (latex == null) {
            return "";
        }
        String text = latex;

        // 1. 去掉外层定界符
        text = WRAP_INLINE.matcher(text).replaceAll("$1");
        text = WRAP_DISPLAY.matcher(text).replaceAll("$1");

        // 2. 格式命令只保留内容：\mathrm{ABC} → ABC
        text = FORMAT_COMMAND.matcher(text).replaceAll("$2");

        // 3. 间距命令 → 空格
        text = SPACING.matcher(text).replaceAll(" ");

        // 4. 下标线性化：x_{10} → x10，x_1 → x1
        text = SUBSCRIPT_GROUP.matcher(text).replaceAll("$1");
        text = SUBSCRIPT_CHAR.matcher(text).replaceAll("$1");

        // 5. 符号替换（先于上标，^{\circ} 会先变成 ^{°}）
        for (Map.Entry<String, Pattern> entry : SYMBOL_PATTERNS.entrySet()) {
            text = entry.getValue().matcher(text).replaceAll(Matcher.quoteReplacement(SYMBOL_MAP.get(entry.getKey())));
        }

        // 6. 上标：能全部映射为上标字符时转换，否则线性化（x^{a} → xa）
        text = replaceSuperscriptGroups(text);
        text = replaceSuperscriptChars(text);
        text = text.replace("^°", "°");

        // 7. 空组、分数、根号、残余花括号
        text = text.replace("{}", "");
        text = FRAC.matcher(text).replaceAll("($1)/($2)");
        text = SQRT.matcher(text).replaceAll("√($1)");
        text = BRACE_GROUP.matcher(text).replaceAll("$1");

        // 8. 折叠空白
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    private static String replaceSuperscriptGroups(String text) {
        Matcher matcher = SUPERSCRIPT_GROUP.matcher(text);
        StringBuffer sb = new StringBuffer();
        while (matcher.find()) {
            String group = matcher.group(1);
            String replacement;
            if ("°".equals(group)) {
                replacement = "°";
            } else {
                String mapped = mapSuperscript(group);
                replacement = SUPERSCRIPT_RESULT.matcher(mapped).matches() ? mapped : group;
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String replaceSuperscriptChars(String text) {
        Matcher matcher = SUPERSCRIPT_CHAR.matcher(text);
        StringBuffer sb = new StringBuffer();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(mapSuperscript(matcher.group(1))));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * 查符号表，command 不带反斜杠，例如 "alpha"；未收录返回 null
     */
    static String symbol(String command) {
        return SYMBOL_MAP.get("\\" + command);
    }

    private static String mapSuperscript(String str) {
        StringBuilder sb = new StringBuilder(str.length());
        for (char c : str.toCharArray()) {
            Character mapped = SUPERSCRIPTS.get(c);
            sb.append(mapped != null ? mapped : c);
        }
        return sb.toString();
    }
}
