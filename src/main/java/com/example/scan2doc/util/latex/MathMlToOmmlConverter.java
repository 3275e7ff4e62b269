package com.example.scan2doc.util.latex;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Presentation MathML → OMML（Office Math Markup Language）
 *
 * 用 jsoup 的 XML 模式解析 MathML，逐元素映射为 m:oMath 片段：
 * <pre>
 * mfrac        → m:f
 * msqrt/mroot  → m:rad
 * msub/msup    → m:sSub / m:sSup / m:sSubSup
 * ∑ ∫ 等大型运算符 + 紧随其后的元素 → m:nary
 * mover/munder → m:acc / m:bar / m:limUpp / m:limLow
 * mtable       → m:m
 * mi/mn/mo/mtext → m:r
 * </pre>
 * 不认识的元素只转换其子元素。annotation 元素忽略。
 */
public final class MathMlToOmmlConverter {

    public static final String OMML_NS = "http://schemas.openxmlformats.org/officeDocument/2006/math";

    private static final Set<String> NARY_CHARS = new HashSet<>(Arrays.asList(
            "∑", "∏", "∐", "∫", "∬", "∭", "∮", "⋃", "⋂", "⨁", "⨂"));

    private static final Set<String> INTEGRALS = new HashSet<>(Arrays.asList("∫", "∬", "∭", "∮"));

    private static final Set<String> SCRIPTED = new HashSet<>(Arrays.asList(
            "msub", "msup", "msubsup", "munder", "mover", "munderover"));

    private MathMlToOmmlConverter() {
    }

    /**
     * 转换
     *
     * @param mathml 含 &lt;math&gt; 根元素的 MathML
     * @return &lt;m:oMath xmlns:m="..."&gt;…&lt;/m:oMath&gt;
     * @throws IllegalArgumentException 输入中没有 math 元素
     */
    public static String convert(String mathml) {
        Document doc = Jsoup.parse(mathml, "", Parser.xmlParser());
        Element math = null;
        for (Element el : doc.getAllElements()) {
            if ("math".equals(localName(el))) {
                math = el;
                break;
            }
        }
        if (math == null) {
            throw new IllegalArgumentException("No <math> element found");
        }

        StringBuilder sb = new StringBuilder();
        sb.append("<m:oMath xmlns:m=\"").append(OMML_NS).append("\">");
        sb.append(convertSequence(math.children(), null));
        sb.append("</m:oMath>");
        return sb.toString();
    }

    private static String convertSequence(List<Element> elements, String variant) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < elements.size(); i++) {
            Element el = elements.get(i);
            String naryChar = naryChar(el);
            if (naryChar != null) {
                // 大型运算符吃掉后面一个元素作为被操作数
                Element body = i + 1 < elements.size() ? elements.get(i + 1) : null;
                sb.append(nary(el, naryChar, body, variant));
                if (body != null) {
                    i++;
                }
                continue;
            }
            sb.append(convertElement(el, variant));
        }
        return sb.toString();
    }

    private static String convertElement(Element el, String variant) {
        String name = localName(el);
        List<Element> kids = el.children();

        switch (name) {
            case "annotation":
            case "annotation-xml":
                return "";
            case "mi":
                return run(el.text(), runStyle(el, variant, el.text().length() > 1));
            case "mn":
            case "mo":
                return run(el.text(), runStyle(el, variant, true));
            case "mtext":
            case "ms":
                return run(el.wholeText(), runStyle(el, variant, true));
            case "mspace":
                return el.attr("width").startsWith("-") ? "" : run(" ", "p");
            case "mfrac": {
                String pr = "0".equals(el.attr("linethickness")) ? "<m:fPr><m:type m:val=\"noBar\"/></m:fPr>" : "";
                return "<m:f>" + pr + "<m:num>" + child(kids, 0, variant) + "</m:num>"
                        + "<m:den>" + child(kids, 1, variant) + "</m:den></m:f>";
            }
            case "msqrt":
                return "<m:rad><m:radPr><m:degHide m:val=\"1\"/></m:radPr><m:deg/>"
                        + "<m:e>" + convertSequence(kids, variant) + "</m:e></m:rad>";
            case "mroot":
                return "<m:rad><m:deg>" + child(kids, 1, variant) + "</m:deg>"
                        + "<m:e>" + child(kids, 0, variant) + "</m:e></m:rad>";
            case "msub":
                return "<m:sSub><m:e>" + child(kids, 0, variant) + "</m:e>"
                        + "<m:sub>" + child(kids, 1, variant) + "</m:sub></m:sSub>";
            case "msup":
                return "<m:sSup><m:e>" + child(kids, 0, variant) + "</m:e>"
                        + "<m:sup>" + child(kids, 1, variant) + "</m:sup></m:sSup>";
            case "msubsup":
                return "<m:sSubSup><m:e>" + child(kids, 0, variant) + "</m:e>"
                        + "<m:sub>" + child(kids, 1, variant) + "</m:sub>"
                        + "<m:sup>" + child(kids, 2, variant) + "</m:sup></m:sSubSup>";
            case "mover":
                return over(kids, variant);
            case "munder":
                return under(kids, variant);
            case "munderover":
                return "<m:limUpp><m:e>" + under(kids.subList(0, Math.min(2, kids.size())), variant) + "</m:e>"
                        + "<m:lim>" + child(kids, 2, variant) + "</m:lim></m:limUpp>";
            case "mtable":
                return matrix(kids, variant);
            case "mstyle": {
                String v = el.hasAttr("mathvariant") ? el.attr("mathvariant") : variant;
                return convertSequence(kids, v);
            }
            default:
                // math / semantics / mrow / mpadded / mphantom / 未知元素
                if (kids.isEmpty() && !el.ownText().trim().isEmpty()) {
                    return run(el.ownText(), "p");
                }
                return convertSequence(kids, variant);
        }
    }

    private static String over(List<Element> kids, String variant) {
        Element accent = kids.size() > 1 ? kids.get(1) : null;
        String base = child(kids, 0, variant);
        if (accent != null && "mo".equals(localName(accent))) {
            String chr = accent.text();
            if ("¯".equals(chr)) {
                return "<m:bar><m:barPr><m:pos m:val=\"top\"/></m:barPr><m:e>" + base + "</m:e></m:bar>";
            }
            return "<m:acc><m:accPr><m:chr m:val=\"" + attr(chr) + "\"/></m:accPr><m:e>" + base + "</m:e></m:acc>";
        }
        return "<m:limUpp><m:e>" + base + "</m:e><m:lim>" + child(kids, 1, variant) + "</m:lim></m:limUpp>";
    }

    private static String under(List<Element> kids, String variant) {
        Element mark = kids.size() > 1 ? kids.get(1) : null;
        String base = child(kids, 0, variant);
        if (mark != null && "mo".equals(localName(mark)) && "_".equals(mark.text())) {
            return "<m:bar><m:barPr><m:pos m:val=\"bot\"/></m:barPr><m:e>" + base + "</m:e></m:bar>";
        }
        return "<m:limLow><m:e>" + base + "</m:e><m:lim>" + child(kids, 1, variant) + "</m:lim></m:limLow>";
    }

    private static String matrix(List<Element> rows, String variant) {
        StringBuilder sb = new StringBuilder("<m:m>");
        for (Element row : rows) {
            if (!"mtr".equals(localName(row)) && !"mlabeledtr".equals(localName(row))) {
                continue;
            }
            sb.append("<m:mr>");
            for (Element cell : row.children()) {
                sb.append("<m:e>").append(convertSequence(cell.children(), variant)).append("</m:e>");
            }
            sb.append("</m:mr>");
        }
        sb.append("</m:m>");
        return sb.toString();
    }

    /**
     * 大型运算符：mo 本身，或以该 mo 为底的上下标元素
     */
    private static String naryChar(Element el) {
        String name = localName(el);
        if ("mo".equals(name) && NARY_CHARS.contains(el.text().trim())) {
            return el.text().trim();
        }
        if (SCRIPTED.contains(name) && !el.children().isEmpty()) {
            Element base = el.child(0);
            if ("mo".equals(localName(base)) && NARY_CHARS.contains(base.text().trim())) {
                return base.text().trim();
            }
        }
        return null;
    }

    private static String nary(Element op, String chr, Element body, String variant) {
        String name = localName(op);
        List<Element> kids = op.children();
        String sub = null;
        String sup = null;
        if ("msub".equals(name) || "munder".equals(name)) {
            sub = child(kids, 1, variant);
        } else if ("msup".equals(name) || "mover".equals(name)) {
            sup = child(kids, 1, variant);
        } else if ("msubsup".equals(name) || "munderover".equals(name)) {
            sub = child(kids, 1, variant);
            sup = child(kids, 2, variant);
        }

        StringBuilder sb = new StringBuilder("<m:nary><m:naryPr>");
        sb.append("<m:chr m:val=\"").append(attr(chr)).append("\"/>");
        sb.append("<m:limLoc m:val=\"").append(INTEGRALS.contains(chr) ? "subSup" : "undOvr").append("\"/>");
        if (sub == null) {
            sb.append("<m:subHide m:val=\"1\"/>");
        }
        if (sup == null) {
            sb.append("<m:supHide m:val=\"1\"/>");
        }
        sb.append("</m:naryPr>");
        sb.append("<m:sub>").append(sub == null ? "" : sub).append("</m:sub>");
        sb.append("<m:sup>").append(sup == null ? "" : sup).append("</m:sup>");
        sb.append("<m:e>").append(body == null ? "" : convertElement(body, variant)).append("</m:e>");
        sb.append("</m:nary>");
        return sb.toString();
    }

    private static String child(List<Element> kids, int index, String variant) {
        if (index >= kids.size()) {
            return "";
        }
        List<Element> single = new ArrayList<>();
        single.add(kids.get(index));
        return convertSequence(single, variant);
    }

    /**
     * OMML 样式：p 正体、b 粗体、i 斜体、bi 粗斜体，null 为默认（单字母斜体）
     */
    private static String runStyle(Element el, String inheritedVariant, boolean upright) {
        String variant = el.hasAttr("mathvariant") ? el.attr("mathvariant") : inheritedVariant;
        if (variant == null) {
            return upright ? "p" : null;
        }
        switch (variant) {
            case "normal":
                return "p";
            case "bold":
                return "b";
            case "italic":
                return "i";
            case "bold-italic":
                return "bi";
            default:
                // double-struck / script / fraktur 等用 m:scr 表示
                return "scr:" + variant;
        }
    }

    private static String run(String text, String style) {
        StringBuilder sb = new StringBuilder("<m:r>");
        if (style != null) {
            sb.append("<m:rPr>");
            if (style.startsWith("scr:")) {
                sb.append("<m:scr m:val=\"").append(attr(style.substring(4))).append("\"/>");
            } else {
                sb.append("<m:sty m:val=\"").append(style).append("\"/>");
            }
            sb.append("</m:rPr>");
        }
        sb.append("<m:t xml:space=\"preserve\">").append(LatexToMathMlConverter.escape(text)).append("</m:t>");
        sb.append("</m:r>");
        return sb.toString();
    }

    private static String attr(String value) {
        return LatexToMathMlConverter.escape(value);
    }

    private static String localName(Element el) {
        String tag = el.tagName();
        int colon = tag.indexOf(':');
        return colon >= 0 ? tag.substring(colon + 1) : tag;
    }
}
