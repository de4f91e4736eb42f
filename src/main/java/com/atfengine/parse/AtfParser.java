package com.atfengine.parse;

import com.atfengine.config.ParserConfig;
import com.atfengine.document.Document;
import com.atfengine.legend.LegendItem;
import com.atfengine.legend.LegendSummarizer;
import com.atfengine.line.LineClassifier;
import com.atfengine.text.WordTokenizer;

import java.util.List;

/**
 * ATF 解析入口：文本 → 文档树 + 图例。
 *
 * <p>无 I/O、无共享可变状态，每次调用新建 {@link DocumentBuilder}，可被多线程并发调用。
 */
public class AtfParser {
    private final ParserConfig config;
    private final LineClassifier classifier;
    private final WordTokenizer tokenizer;
    private final LegendSummarizer legendSummarizer;

    public AtfParser() {
        this(ParserConfig.defaults());
    }

    public AtfParser(ParserConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("解析配置不能为空");
        }
        this.config = config;
        this.classifier = new LineClassifier();
        this.tokenizer = new WordTokenizer();
        this.legendSummarizer = new LegendSummarizer();
    }

    /**
     * 解析完整转写文本；关闭图例时 legend 为空列表。
     */
    public ParseResult parse(String atf) {
        Document document = parseDocument(atf);
        List<LegendItem> legend = config.isLegendEnabled()
            ? legendSummarizer.summarize(document)
            : List.of();
        return new ParseResult(document, legend);
    }

    /**
     * 仅构建文档树，null 视为空文本。
     */
    public Document parseDocument(String atf) {
        return new DocumentBuilder(config, classifier, tokenizer)
            .acceptAll(atf)
            .build();
    }

    public record ParseResult(Document document, List<LegendItem> legend) {
    }
}
