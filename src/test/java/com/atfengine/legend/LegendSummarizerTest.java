package com.atfengine.legend;

import com.atfengine.document.Document;
import com.atfengine.parse.AtfParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LegendSummarizerTest {

    private final LegendSummarizer summarizer = new LegendSummarizer();

    @Test
    @DisplayName("没有特征时只输出两条释义占位")
    void testPlainTextOnlyHasDefinitionEntries() {
        List<LegendItem> legend = summarizer.summarize(parse("1. lugal e2 du3"));

        assertEquals(List.of(LegendSummarizer.HAS_DEFINITION, LegendSummarizer.NO_DEFINITION), legend);
    }

    @Test
    @DisplayName("全部特征按固定顺序输出")
    void testAllFeaturesInFixedOrder() {
        Document document = parse("1. [...] a? b# _e2_ lugal{ki} {d}inana\n#tr.en: x");

        assertEquals(
            List.of("has-definition", "no-definition", "det-divine", "det-place", "logogram",
                "damaged", "uncertain", "broken", "translation"),
            classes(summarizer.summarize(document)));
    }

    @Test
    @DisplayName("city 与 land 限定符不算地名")
    void testOnlyPlaceTypeCountsAsPlace() {
        List<LegendItem> legend = summarizer.summarize(parse("1. {iri}ur {kur}mar-tu"));

        assertEquals(List.of("has-definition", "no-definition"), classes(legend));
    }

    @Test
    @DisplayName("校正标记没有图例")
    void testCorrectedWordHasNoLegendEntry() {
        assertEquals(2, summarizer.summarize(parse("1. a!")).size());
    }

    @Test
    @DisplayName("状态行与表面级状态不影响图例")
    void testStateLinesIgnored() {
        assertEquals(2, summarizer.summarize(parse("$ [...] broken#\n@column 1\n$ x#")).size());
    }

    @Test
    void testNullDocument() {
        assertEquals(2, summarizer.summarize(null).size());
    }

    private static Document parse(String atf) {
        return new AtfParser().parseDocument(atf);
    }

    private static List<String> classes(List<LegendItem> legend) {
        return legend.stream().map(LegendItem::cssClass).collect(Collectors.toList());
    }
}
