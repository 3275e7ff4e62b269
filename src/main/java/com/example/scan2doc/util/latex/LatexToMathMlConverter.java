package com.example.scan2doc.util.latex;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * LaTeX → Presentation MathML（递归下降）
 *
 * 支持的子集：
 * <ul>
 *   <li>字母、数字、运算符；{} 分组；^ / _ 上下标</li>
 *   <li>\frac \dfrac \tfrac、\sqrt（含 [n] 次方根）、\left … \right 定界符</li>
 *   <li>\text \mathrm \operatorname、\mathbf \mathit \mathbb \mathcal</li>
 *   <li>\hat \bar \vec \tilde \dot \overline 与下划线命令</li>
 *   <li>\sum \prod \int 等大型运算符、\sin \log \lim 等函数名</li>
 *   <li>matrix / pmatrix / bmatrix / vmatrix / cases / aligned / array 环境</li>
 *   <li>希腊字母与常用关系符（与 {@link LatexToUnicodeConverter} 共用符号表）</li>
 * </ul>
 * 不认识的命令输出为 &lt;mtext&gt;\name&lt;/mtext&gt;，内容不丢失。
 * 括号不配对等结构错误抛出 {@link IllegalArgumentException}，由调用方降级为纯文本。
 *
 * 输出带 TeX 注释：&lt;math&gt;&lt;semantics&gt;…&lt;annotation encoding="application/x-tex"&gt;…&lt;/annotation&gt;&lt;/semantics&gt;&lt;/math&gt;
 */
public final class LatexToMathMlConverter {

    public static final String MATHML_NS = "http://www.w3.org/1998/Math/MathML";

    private static final Map<String, String> EXTRA_SYMBOLS = new HashMap<>();
    private static final Map<String, String> LARGE_OPERATORS = new HashMap<>();
    private static final Set<String> FUNCTIONS = new HashSet<>();
    private static final Map<String, String> ACCENTS = new HashMap<>();
    private static final Map<String, String> VARIANTS = new HashMap<>();
    private static final Map<String, String> SPACES = new HashMap<>();

    static {
        EXTRA_SYMBOLS.put("ldots", "…");
        EXTRA_SYMBOLS.put("dots", "…");
        EXTRA_SYMBOLS.put("cdots", "⋯");
        EXTRA_SYMBOLS.put("vdots", "⋮");
        EXTRA_SYMBOLS.put("ddots", "⋱");
        EXTRA_SYMBOLS.put("prime", "′");
        EXTRA_SYMBOLS.put("to", "→");
        EXTRA_SYMBOLS.put("gets", "←");
        EXTRA_SYMBOLS.put("mapsto", "↦");
        EXTRA_SYMBOLS.put("Leftarrow", "⇐");
        EXTRA_SYMBOLS.put("leftrightarrow", "↔");
        EXTRA_SYMBOLS.put("implies", "⟹");
        EXTRA_SYMBOLS.put("iff", "⟺");
        EXTRA_SYMBOLS.put("varepsilon", "ε");
        EXTRA_SYMBOLS.put("vartheta", "ϑ");
        EXTRA_SYMBOLS.put("varphi", "ϕ");
        EXTRA_SYMBOLS.put("varrho", "ϱ");
        EXTRA_SYMBOLS.put("ell", "ℓ");
        EXTRA_SYMBOLS.put("hbar", "ℏ");
        EXTRA_SYMBOLS.put("propto", "∝");
        EXTRA_SYMBOLS.put("perp", "⊥");
        EXTRA_SYMBOLS.put("parallel", "∥");
        EXTRA_SYMBOLS.put("subseteq", "⊆");
        EXTRA_SYMBOLS.put("supseteq", "⊇");
        EXTRA_SYMBOLS.put("setminus", "∖");
        EXTRA_SYMBOLS.put("land", "∧");
        EXTRA_SYMBOLS.put("lor", "∨");
        EXTRA_SYMBOLS.put("neg", "¬");
        EXTRA_SYMBOLS.put("ll", "≪");
        EXTRA_SYMBOLS.put("gg", "≫");
        EXTRA_SYMBOLS.put("cong", "≅");
        EXTRA_SYMBOLS.put("simeq", "≃");
        EXTRA_SYMBOLS.put("ast", "∗");
        EXTRA_SYMBOLS.put("star", "⋆");
        EXTRA_SYMBOLS.put("bullet", "∙");
        EXTRA_SYMBOLS.put("oplus", "⊕");
        EXTRA_SYMBOLS.put("otimes", "⊗");
        EXTRA_SYMBOLS.put("degree", "°");
        EXTRA_SYMBOLS.put("langle", "⟨");
        EXTRA_SYMBOLS.put("rangle", "⟩");
        EXTRA_SYMBOLS.put("lfloor", "⌊");
        EXTRA_SYMBOLS.put("rfloor", "⌋");
        EXTRA_SYMBOLS.put("lceil", "⌈");
        EXTRA_SYMBOLS.put("rceil", "⌉");
        EXTRA_SYMBOLS.put("vert", "|");
        EXTRA_SYMBOLS.put("Vert", "‖");
        EXTRA_SYMBOLS.put("mid", "∣");
        EXTRA_SYMBOLS.put("{", "{");
        EXTRA_SYMBOLS.put("}", "}");
        EXTRA_SYMBOLS.put("$", "$");
        EXTRA_SYMBOLS.put("#", "#");
        EXTRA_SYMBOLS.put("&", "&");
        EXTRA_SYMBOLS.put("_", "_");
        EXTRA_SYMBOLS.put("|", "‖");

        LARGE_OPERATORS.put("sum", "∑");
        LARGE_OPERATORS.put("prod", "∏");
        LARGE_OPERATORS.put("coprod", "∐");
        LARGE_OPERATORS.put("int", "∫");
        LARGE_OPERATORS.put("iint", "∬");
        LARGE_OPERATORS.put("iiint", "∭");
        LARGE_OPERATORS.put("oint", "∮");
        LARGE_OPERATORS.put("bigcup", "⋃");
        LARGE_OPERATORS.put("bigcap", "⋂");
        LARGE_OPERATORS.put("bigoplus", "⨁");
        LARGE_OPERATORS.put("bigotimes", "⨂");

        for (String fn : new String[]{"sin", "cos", "tan", "cot", "sec", "csc", "arcsin", "arccos", "arctan",
                "sinh", "cosh", "tanh", "log", "ln", "lg", "exp", "lim", "liminf", "limsup", "max", "min",
                "sup", "inf", "det", "dim", "ker", "deg", "gcd", "arg", "Pr", "mod"}) {
            FUNCTIONS.add(fn);
        }

        ACCENTS.put("hat", "^");
        ACCENTS.put("widehat", "^");
        ACCENTS.put("bar", "¯");
        ACCENTS.put("overline", "¯");
        ACCENTS.put("vec", "→");
        ACCENTS.put("overrightarrow", "→");
        ACCENTS.put("tilde", "~");
        ACCENTS.put("widetilde", "~");
        ACCENTS.put("dot", "˙");
        ACCENTS.put("ddot", "¨");

        VARIANTS.put("mathbf", "bold");
        VARIANTS.put("boldsymbol", "bold-italic");
        VARIANTS.put("mathit", "italic");
        VARIANTS.put("mathbb", "double-struck");
        VARIANTS.put("mathcal", "script");
        VARIANTS.put("mathfrak", "fraktur");
        VARIANTS.put("mathsf", "sans-serif");
        VARIANTS.put("mathtt", "monospace");

        SPACES.put(",", "0.167em");
        SPACES.put(":", "0.222em");
        SPACES.put(";", "0.278em");
        SPACES.put(" ", "0.333em");
        SPACES.put("quad", "1em");
        SPACES.put("qquad", "2em");
        SPACES.put("!", "-0.167em");
    }

    private final String src;
    private int pos;

    private LatexToMathMlConverter(String src) {
        this.src = src;
        this.pos = 0;
    }

    /**
     * 转换为 MathML
     *
     * @param latex LaTeX 源码（不含 $ 定界符）
     * @param display 是否为独立公式（display="block"）
     * @return 完整 &lt;math&gt; 元素
     * @throws IllegalArgumentException 结构错误（括号不配对、环境未闭合等）
     */
    public static String convert(String latex, boolean display) {
        if (latex == null) {
            throw new IllegalArgumentException("latex is null");
        }
        LatexToMathMlConverter parser = new LatexToMathMlConverter(latex);
        String body = parser.parseSequence(Stop.END);
        if (parser.pos < parser.src.length()) {
            throw new IllegalArgumentException("Unexpected '" + parser.src.charAt(parser.pos) + "' at " + parser.pos);
        }

        StringBuilder sb = new StringBuilder();
        sb.append("<math xmlns=\"").append(MATHML_NS).append("\"");
        if (display) {
            sb.append(" display=\"block\"");
        }
        sb.append("><semantics><mrow>").append(body).append("</mrow>");
        sb.append("<annotation encoding=\"application/x-tex\">").append(escape(latex)).append("</annotation>");
        sb.append("</semantics></math>");
        return sb.toString();
    }

    /**
     * 序列的结束条件
     */
    private enum Stop {
        /** 读到文本结尾 */
        END,
        /** 读到 } */
        BRACE,
        /** 读到 ] */
        BRACKET,
        /** 读到 \right */
        RIGHT,
        /** 读到 & 、\\ 或 \end */
        CELL
    }

    private String parseSequence(Stop stop) {
        StringBuilder sb = new StringBuilder();
        while (true) {
            skipWhitespace();
            if (pos >= src.length()) {
                if (stop != Stop.END) {
                    throw new IllegalArgumentException("Unterminated group, expected " + stop);
                }
                return sb.toString();
            }
            char c = src.charAt(pos);
            if (c == '}') {
                if (stop == Stop.BRACE) {
                    return sb.toString();
                }
                throw new IllegalArgumentException("Unbalanced '}' at " + pos);
            }
            if (c == ']' && stop == Stop.BRACKET) {
                return sb.toString();
            }
            if (stop == Stop.RIGHT && lookingAtCommand("right")) {
                return sb.toString();
            }
            if (stop == Stop.CELL && (c == '&' || src.startsWith("\\\\", pos) || lookingAtCommand("end"))) {
                return sb.toString();
            }
            sb.append(parseScripted());
        }
    }

    /**
     * 原子 + 可选的上下标
     */
    private String parseScripted() {
        String base;
        char c = src.charAt(pos);
        if (c == '^' || c == '_') {
            base = "<mrow></mrow>";
        } else {
            base = parseAtom();
        }

        String sub = null;
        String sup = null;
        while (true) {
            skipWhitespace();
            if (pos >= src.length()) {
                break;
            }
            char s = src.charAt(pos);
            if (s == '_' && sub == null) {
                pos++;
                sub = parseArgument();
            } else if (s == '^' && sup == null) {
                pos++;
                sup = parseArgument();
            } else if (s == '\'') {
                // f' → f^{′}
                pos++;
                sup = (sup == null ? "" : sup) + "<mo>′</mo>";
            } else {
                break;
            }
        }

        if (sub != null && sup != null) {
            return "<msubsup>" + base + wrap(sub) + wrap(sup) + "</msubsup>";
        }
        if (sub != null) {
            return "<msub>" + base + wrap(sub) + "</msub>";
        }
        if (sup != null) {
            return "<msup>" + base + wrap(sup) + "</msup>";
        }
        return base;
    }

    private String parseAtom() {
        char c = src.charAt(pos);
        if (c == '{') {
            pos++;
            String inner = parseSequence(Stop.BRACE);
            pos++;
            return "<mrow>" + inner + "</mrow>";
        }
        if (c == '\\') {
            return parseCommand();
        }
        if (Character.isDigit(c) || (c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1)))) {
            int start = pos;
            while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '.')) {
                pos++;
            }
            return "<mn>" + src.substring(start, pos) + "</mn>";
        }
        if (Character.isLetter(c)) {
            pos++;
            return "<mi>" + escape(String.valueOf(c)) + "</mi>";
        }
        pos++;
        return "<mo>" + escape(String.valueOf(c)) + "</mo>";
    }

    /**
     * 命令参数：{...} 分组或单个原子
     */
    private String parseArgument() {
        skipWhitespace();
        if (pos >= src.length()) {
            throw new IllegalArgumentException("Missing argument at end of input");
        }
        if (src.charAt(pos) == '{') {
            pos++;
            String inner = parseSequence(Stop.BRACE);
            pos++;
            return inner;
        }
        return parseAtom();
    }

    /**
     * 原样读取 {...} 中的文本（\text 等）
     */
    private String readRawGroup() {
        skipWhitespace();
        if (pos >= src.length() || src.charAt(pos) != '{') {
            if (pos < src.length()) {
                return String.valueOf(src.charAt(pos++));
            }
            throw new IllegalArgumentException("Missing group at end of input");
        }
        int depth = 0;
        int start = pos + 1;
        for (int i = pos; i < src.length(); i++) {
            char ch = src.charAt(i);
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    pos = i + 1;
                    return src.substring(start, i);
                }
            }
        }
        throw new IllegalArgumentException("Unterminated group at " + pos);
    }

    private String parseCommand() {
        pos++; // '\'
        if (pos >= src.length()) {
            return "<mo>\\</mo>";
        }

        char first = src.charAt(pos);
        String name;
        if (Character.isLetter(first)) {
            int start = pos;
            while (pos < src.length() && Character.isLetter(src.charAt(pos))) {
                pos++;
            }
            name = src.substring(start, pos);
        } else {
            pos++;
            name = String.valueOf(first);
        }

        if (SPACES.containsKey(name)) {
            return "<mspace width=\"" + SPACES.get(name) + "\"/>";
        }
        if ("\\".equals(name)) {
            // 环境之外的换行
            return "";
        }

        switch (name) {
            case "frac":
            case "dfrac":
            case "tfrac":
            case "cfrac": {
                String num = parseArgument();
                String den = parseArgument();
                return "<mfrac>" + wrap(num) + wrap(den) + "</mfrac>";
            }
            case "binom": {
                String n = parseArgument();
                String k = parseArgument();
                return "<mrow><mo>(</mo><mfrac linethickness=\"0\">" + wrap(n) + wrap(k) + "</mfrac><mo>)</mo></mrow>";
            }
            case "sqrt": {
                skipWhitespace();
                if (pos < src.length() && src.charAt(pos) == '[') {
                    pos++;
                    String index = parseSequence(Stop.BRACKET);
                    pos++;
                    String radicand = parseArgument();
                    return "<mroot>" + wrap(radicand) + wrap(index) + "</mroot>";
                }
                return "<msqrt>" + parseArgument() + "</msqrt>";
            }
            case "left": {
                String open = readDelimiter();
                String inner = parseSequence(Stop.RIGHT);
                pos += "\\right".length();
                String close = readDelimiter();
                return "<mrow>" + fence(open) + inner + fence(close) + "</mrow>";
            }
            case "text":
            case "textrm":
            case "textbf":
            case "textit":
            case "mbox":
                return "<mtext>" + escape(readRawGroup()) + "</mtext>";
            case "mathrm":
            case "operatorname":
                return "<mi mathvariant=\"normal\">" + escape(readRawGroup()) + "</mi>";
            case "underline":
                return "<munder accentunder=\"true\">" + wrap(parseArgument()) + "<mo>_</mo></munder>";
            case "begin":
                return parseEnvironment(readRawGroup());
            case "displaystyle":
            case "textstyle":
            case "limits":
            case "nolimits":
            case "big":
            case "Big":
            case "bigg":
            case "Bigg":
                return "";
            default:
                break;
        }

        if (VARIANTS.containsKey(name)) {
            return "<mstyle mathvariant=\"" + VARIANTS.get(name) + "\">" + parseArgument() + "</mstyle>";
        }
        if (ACCENTS.containsKey(name)) {
            return "<mover accent=\"true\">" + wrap(parseArgument()) + "<mo>" + ACCENTS.get(name) + "</mo></mover>";
        }
        if (LARGE_OPERATORS.containsKey(name)) {
            return "<mo largeop=\"true\">" + LARGE_OPERATORS.get(name) + "</mo>";
        }
        if (FUNCTIONS.contains(name)) {
            return "<mi mathvariant=\"normal\">" + name + "</mi>";
        }

        String symbol = LatexToUnicodeConverter.symbol(name);
        if (symbol == null) {
            symbol = EXTRA_SYMBOLS.get(name);
        }
        if (symbol != null) {
            if (isGreek(symbol)) {
                return "<mi>" + symbol + "</mi>";
            }
            return "<mo>" + escape(symbol) + "</mo>";
        }

        return "<mtext>\\" + escape(name) + "</mtext>";
    }

    /**
     * \begin{env} ... \end{env}
     */
    private String parseEnvironment(String env) {
        String open = "";
        String close = "";
        switch (env) {
            case "pmatrix":
                open = "(";
                close = ")";
                break;
            case "bmatrix":
                open = "[";
                close = "]";
                break;
            case "Bmatrix":
            case "cases":
                open = "{";
                close = env.equals("cases") ? "" : "}";
                break;
            case "vmatrix":
                open = "|";
                close = "|";
                break;
            case "Vmatrix":
                open = "‖";
                close = "‖";
                break;
            case "array":
                // 列格式说明不影响输出
                readRawGroup();
                break;
            default:
                break;
        }

        StringBuilder table = new StringBuilder("<mtable>");
        StringBuilder row = new StringBuilder("<mtr>");
        boolean rowHasCells = false;
        while (true) {
            String cell = parseSequence(Stop.CELL);
            row.append("<mtd>").append(cell).append("</mtd>");
            rowHasCells = true;

            if (pos >= src.length()) {
                throw new IllegalArgumentException("Unterminated environment: " + env);
            }
            if (src.charAt(pos) == '&') {
                pos++;
                continue;
            }
            if (src.startsWith("\\\\", pos)) {
                pos += 2;
                table.append(row).append("</mtr>");
                row = new StringBuilder("<mtr>");
                rowHasCells = false;
                continue;
            }
            // \end{env}
            pos += "\\end".length();
            String endName = readRawGroup();
            if (!env.equals(endName)) {
                throw new IllegalArgumentException("Mismatched environment: " + env + " / " + endName);
            }
            break;
        }
        if (rowHasCells) {
            table.append(row).append("</mtr>");
        }
        table.append("</mtable>");

        if (open.isEmpty() && close.isEmpty()) {
            return table.toString();
        }
        return "<mrow>" + fence(open) + table + fence(close) + "</mrow>";
    }

    private String readDelimiter() {
        skipWhitespace();
        if (pos >= src.length()) {
            throw new IllegalArgumentException("Missing delimiter at end of input");
        }
        char c = src.charAt(pos);
        if (c == '\\') {
            int start = ++pos;
            if (pos < src.length() && !Character.isLetter(src.charAt(pos))) {
                pos++;
            } else {
                while (pos < src.length() && Character.isLetter(src.charAt(pos))) {
                    pos++;
                }
            }
            String name = src.substring(start, pos);
            String symbol = EXTRA_SYMBOLS.get(name);
            return symbol != null ? symbol : "";
        }
        pos++;
        return c == '.' ? "" : String.valueOf(c);
    }

    private static String fence(String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            return "";
        }
        return "<mo fence=\"true\">" + escape(delimiter) + "</mo>";
    }

    private boolean lookingAtCommand(String name) {
        String token = "\\" + name;
        if (!src.startsWith(token, pos)) {
            return false;
        }
        int after = pos + token.length();
        return after >= src.length() || !Character.isLetter(src.charAt(after));
    }

    private void skipWhitespace() {
        while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) {
            pos++;
        }
    }

    private static String wrap(String content) {
        return "<mrow>" + content + "</mrow>";
    }

    private static boolean isGreek(String symbol) {
        return symbol.length() == 1
                && Character.UnicodeBlock.of(symbol.charAt(0)) == Character.UnicodeBlock.GREEK;
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&':
                    sb.append("&amp;");
                    break;
                case '<':
                    sb.append("&lt;");
                    break;
                case '>':
                    sb.append("&gt;");
                    break;
                case '"':
                    sb.append("&quot;");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
