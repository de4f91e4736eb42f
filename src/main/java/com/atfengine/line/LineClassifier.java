package com.atfengine.line;

import com.atfengine.config.Constants;
import com.atfengine.document.CompositeRef;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按固定优先级判断一行 ATF 的种类，首个匹配生效。
 */
public class LineClassifier {
    private static final Pattern HEADER = Pattern.compile("^&(\\S+?)\\s*=\\s*(.+)$");
    private static final Pattern LANGUAGE = Pattern.compile("^#atf:\\s*lang\\s+(\\S+)");
    private static final Pattern TRANSLATION = Pattern.compile("^#tr\\.(\\w+):\\s*(.+)$");
    private static final Pattern OBJECT_TYPE = Pattern.compile("^@(tablet|bulla|envelope|prism|fragment|object)");
    private static final Pattern NAMED_SURFACE = Pattern.compile(
        "^@(obverse|reverse|left|right|top|bottom|edge|face|seal)(?:\\s+(\\S+))?");
    private static final Pattern GENERIC_SURFACE = Pattern.compile("^@surface\\s+(\\S+)");
    private static final Pattern COLUMN = Pattern.compile("^@column\\s+(\\d{1,9})(?!\\d)");
    private static final Pattern COMPOSITE = Pattern.compile("^>>(Q\\d+)\\s+(.+)$");
    private static final Pattern CONTENT = Pattern.compile("^(\\d+['\"]?)\\.?\\s+(.*)$");

    private static final String DIRECTIVE_PREFIXES = "&@#$>";

    /**
     * 分类一行文本。调用方通常已去除首尾空白并跳过空行，这里仍会再 trim 一次。
     */
    public ClassifiedLine classify(String rawLine) {
        String line = rawLine == null ? "" : rawLine.trim();
        if (line.isEmpty()) {
            return new ClassifiedLine.Unknown(line);
        }

        Matcher matcher = HEADER.matcher(line);
        if (matcher.find()) {
            return new ClassifiedLine.Header(matcher.group(1), matcher.group(2).trim());
        }

        matcher = LANGUAGE.matcher(line);
        if (matcher.find()) {
            return new ClassifiedLine.Language(matcher.group(1));
        }

        matcher = TRANSLATION.matcher(line);
        if (matcher.find()) {
            return new ClassifiedLine.Translation(matcher.group(1), matcher.group(2).trim());
        }

        if (line.startsWith("#")) {
            return new ClassifiedLine.Comment(line.substring(1));
        }

        matcher = OBJECT_TYPE.matcher(line);
        if (matcher.find()) {
            return new ClassifiedLine.ObjectType(matcher.group(1));
        }

        matcher = NAMED_SURFACE.matcher(line);
        if (matcher.find()) {
            return new ClassifiedLine.Surface(matcher.group(1), matcher.group(2));
        }

        matcher = GENERIC_SURFACE.matcher(line);
        if (matcher.find()) {
            return new ClassifiedLine.Surface(Constants.GENERIC_SURFACE_NAME, matcher.group(1));
        }

        matcher = COLUMN.matcher(line);
        if (matcher.find()) {
            return new ClassifiedLine.Column(Integer.parseInt(matcher.group(1)));
        }

        if (line.startsWith("$")) {
            return new ClassifiedLine.State(line.substring(1).trim());
        }

        matcher = COMPOSITE.matcher(line);
        if (matcher.find()) {
            return new ClassifiedLine.Composite(new CompositeRef(matcher.group(1), matcher.group(2).trim()));
        }

        matcher = CONTENT.matcher(line);
        if (matcher.find()) {
            String label = matcher.group(1);
            return new ClassifiedLine.Content(label + ".", matcher.group(2), label.contains("'"));
        }

        if (DIRECTIVE_PREFIXES.indexOf(line.charAt(0)) < 0) {
            return new ClassifiedLine.Content("", line, false);
        }

        return new ClassifiedLine.Unknown(line);
    }
}
