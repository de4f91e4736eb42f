package com.atfengine.record;

import com.atfengine.config.Constants;
import com.atfengine.config.ParserConfig;
import com.atfengine.document.Column;
import com.atfengine.document.CompositeRef;
import com.atfengine.document.Document;
import com.atfengine.document.Header;
import com.atfengine.document.Line;
import com.atfengine.document.Surface;
import com.atfengine.text.WordTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 将存储层的扁平行记录组装为与文本解析相同结构的文档树。
 *
 * <p>按表面类型、再按栏号分组，均保持首次出现的顺序。
 */
public class LineRecordAssembler {
    private static final Logger logger = LoggerFactory.getLogger(LineRecordAssembler.class);

    private static final Pattern INLINE_COMPOSITE = Pattern.compile(">>(Q\\d+)\\s+(.+)$");
    private static final String RULING_STATE = "ruling";

    private final WordTokenizer tokenizer;
    private final ParserConfig config;

    public LineRecordAssembler() {
        this(ParserConfig.defaults(), new WordTokenizer());
    }

    public LineRecordAssembler(ParserConfig config, WordTokenizer tokenizer) {
        if (config == null || tokenizer == null) {
            throw new IllegalArgumentException("配置与分词器不能为空");
        }
        this.config = config;
        this.tokenizer = tokenizer;
    }

    public Document assemble(List<LineRecord> records) {
        if (records == null || records.isEmpty()) {
            return new Document(emptyHeader(), List.of(), List.of(), false, false);
        }

        Map<String, Map<Integer, List<LineRecord>>> grouped = new LinkedHashMap<>();
        for (LineRecord record : records) {
            if (record == null) {
                continue;
            }
            String surfaceType = record.surfaceType() == null || record.surfaceType().isBlank()
                ? config.getDefaultSurfaceName()
                : record.surfaceType();
            grouped.computeIfAbsent(surfaceType, key -> new LinkedHashMap<>())
                .computeIfAbsent(record.columnNumber(), key -> new ArrayList<>())
                .add(record);
        }

        List<Surface> surfaces = new ArrayList<>(grouped.size());
        List<CompositeRef> compositeRefs = new ArrayList<>();
        for (Map.Entry<String, Map<Integer, List<LineRecord>>> surfaceEntry : grouped.entrySet()) {
            List<Column> columns = new ArrayList<>();
            for (Map.Entry<Integer, List<LineRecord>> columnEntry : surfaceEntry.getValue().entrySet()) {
                List<Line> lines = new ArrayList<>();
                for (LineRecord record : columnEntry.getValue()) {
                    Line line = toLine(record);
                    if (line == null) {
                        continue;
                    }
                    if (line instanceof Line.ContentLine contentLine && contentLine.composite() != null) {
                        compositeRefs.add(contentLine.composite());
                    }
                    lines.add(line);
                }
                int columnNumber = columnEntry.getKey();
                columns.add(new Column(columnNumber, columnNumber == Constants.IMPLICIT_COLUMN_NUMBER, lines));
            }
            String name = surfaceEntry.getKey();
            surfaces.add(new Surface(name, Surface.labelFor(name, null), null, columns, List.of()));
        }

        logger.debug("行记录组装完成: records={}, surfaces={}", records.size(), surfaces.size());
        return new Document(
            emptyHeader(),
            surfaces,
            compositeRefs,
            surfaces.size() > 1,
            Document.computeMultipleColumns(surfaces)
        );
    }

    /**
     * 单条记录转为行；无文本的空白行返回 null。
     */
    private Line toLine(LineRecord record) {
        String rawAtf = record.rawAtf() == null ? "" : record.rawAtf().trim();

        if (rawAtf.startsWith("$")) {
            return new Line.StateLine(rawAtf.substring(1).trim());
        }
        if (record.blank()) {
            return rawAtf.isEmpty() ? null : new Line.StateLine(stripStatePrefix(rawAtf));
        }
        if (record.ruling()) {
            return new Line.StateLine(RULING_STATE);
        }

        String lineNumber = record.lineNumber() == null ? "" : record.lineNumber();
        String label = stripTrailingDots(lineNumber);
        if (!label.isEmpty()) {
            label += ".";
        }

        CompositeRef composite = null;
        String content = rawAtf;
        Matcher matcher = INLINE_COMPOSITE.matcher(rawAtf);
        if (matcher.find()) {
            composite = new CompositeRef(matcher.group(1), matcher.group(2).trim());
            content = rawAtf.substring(0, matcher.start()).trim();
        }

        return new Line.ContentLine(label, lineNumber.contains("'"), rawAtf, tokenizer.tokenize(content),
            composite, Map.of());
    }

    private Header emptyHeader() {
        return new Header(null, null, null, config.getDefaultObjectType());
    }

    private static String stripStatePrefix(String value) {
        int start = 0;
        while (start < value.length() && (value.charAt(start) == '$' || value.charAt(start) == ' ')) {
            start++;
        }
        return value.substring(start).trim();
    }

    private static String stripTrailingDots(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '.') {
            end--;
        }
        return value.substring(0, end);
    }
}
