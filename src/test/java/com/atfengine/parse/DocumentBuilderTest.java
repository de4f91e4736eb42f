package com.atfengine.parse;

import com.atfengine.config.ParserConfig;
import com.atfengine.document.Column;
import com.atfengine.document.CompositeRef;
import com.atfengine.document.Document;
import com.atfengine.document.Line;
import com.atfengine.document.Surface;
import com.atfengine.line.LineClassifier;
import com.atfengine.text.WordTokenizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentBuilderTest {

    @Test
    @DisplayName("内容先于表面声明时自动创建 obverse 与隐式栏")
    void testAutoSurfaceCreation() {
        Document document = build("1. lugal e2 du3");

        assertEquals(1, document.surfaces().size());
        Surface surface = document.surfaces().get(0);
        assertEquals("obverse", surface.name());
        assertEquals("Obverse", surface.label());
        assertNull(surface.modifier());
        assertEquals(1, surface.columns().size());
        assertEquals(0, surface.columns().get(0).number());
        assertTrue(surface.columns().get(0).implicit());
        assertEquals(1, surface.columns().get(0).lines().size());
        Line.ContentLine line = assertInstanceOf(Line.ContentLine.class, surface.columns().get(0).lines().get(0));
        assertEquals("1.", line.number());
        assertEquals(3, line.words().size());
        assertFalse(document.hasMultipleSurfaces());
        assertFalse(document.hasMultipleColumns());
    }

    @Test
    @DisplayName("随后出现的 @obverse 复用自动创建的表面")
    void testSurfaceReuse() {
        Document document = build("1. x\n@obverse\n2. y");

        assertEquals(1, document.surfaces().size());
        List<Column> columns = document.surfaces().get(0).columns();
        assertEquals(1, columns.size());
        assertEquals(2, columns.get(0).lines().size());
        assertEquals("2.", ((Line.ContentLine) columns.get(0).lines().get(1)).number());
    }

    @Test
    @DisplayName("复用规则只认 @obverse，与配置的默认表面名无关")
    void testSurfaceReuseWithConfiguredDefaultSurface() {
        ParserConfig config = ParserConfig.defaults();
        config.setDefaultSurfaceName("surface");

        Document reused = new DocumentBuilder(config, new LineClassifier(), new WordTokenizer())
            .acceptAll("1. x\n@obverse\n2. y")
            .build();
        assertEquals(1, reused.surfaces().size());
        assertEquals("obverse", reused.surfaces().get(0).name());
        assertEquals("Obverse", reused.surfaces().get(0).label());
        assertEquals(2, reused.surfaces().get(0).columns().get(0).lines().size());

        Document separate = new DocumentBuilder(config, new LineClassifier(), new WordTokenizer())
            .acceptAll("1. x\n@surface a\n2. y")
            .build();
        assertEquals(2, separate.surfaces().size());
        assertEquals("surface", separate.surfaces().get(0).name());
    }

    @Test
    @DisplayName("显式 @column 0 不是隐式栏")
    void testExplicitColumnZero() {
        Document document = build("@obverse\n@column 0\n$ broken\n1. a");

        Column column = document.surfaces().get(0).columns().get(0);
        assertEquals(0, column.number());
        assertFalse(column.implicit());
        assertEquals(2, column.lines().size());
        assertTrue(document.surfaces().get(0).states().isEmpty());
    }

    @Test
    @DisplayName("带修饰符的 obverse 不复用")
    void testModifiedObverseCreatesNewSurface() {
        Document document = build("1. x\n@obverse a\n2. y");

        assertEquals(2, document.surfaces().size());
        assertEquals("Obverse a", document.surfaces().get(1).label());
        assertTrue(document.hasMultipleSurfaces());
    }

    @Test
    @DisplayName("唯一的 @column 2 也算多栏")
    void testSingleHighNumberedColumn() {
        Document document = build("@obverse\n@column 2\n1. a");

        assertEquals(1, document.surfaces().get(0).columns().size());
        assertEquals(2, document.surfaces().get(0).columns().get(0).number());
        assertTrue(document.hasMultipleColumns());
    }

    @Test
    @DisplayName("@column 先于表面声明时自动创建表面")
    void testColumnBeforeSurface() {
        Document document = build("@column 1\n1. a\n@column 2\n2. b");

        assertEquals(1, document.surfaces().size());
        List<Column> columns = document.surfaces().get(0).columns();
        assertEquals(2, columns.size());
        assertEquals(1, columns.get(0).lines().size());
        assertEquals(1, columns.get(1).lines().size());
        assertTrue(document.hasMultipleColumns());
    }

    @Test
    @DisplayName("状态行：栏内或表面级")
    void testStatePlacement() {
        Document document = build("@obverse\n$ beginning broken\n@column 1\n1. a\n$ rest broken");

        Surface surface = document.surfaces().get(0);
        assertEquals(List.of(new Line.StateLine("beginning broken")), surface.states());
        List<Line> lines = surface.columns().get(0).lines();
        assertEquals(2, lines.size());
        assertEquals(new Line.StateLine("rest broken"), lines.get(1));
    }

    @Test
    @DisplayName("切换表面后内容进入新表面的隐式栏")
    void testSurfaceSwitchResetsColumn() {
        Document document = build("@obverse\n@column 1\n1. a\n@column 2\n1. b\n@reverse\n1. c");

        Surface reverse = document.surfaces().get(1);
        assertEquals("Reverse", reverse.label());
        assertEquals(1, reverse.columns().size());
        assertEquals(0, reverse.columns().get(0).number());
        assertEquals(1, reverse.columns().get(0).lines().size());
    }

    @Test
    @DisplayName("复合文本引用附着到紧邻的内容行")
    void testCompositeAttachment() {
        Document document = build("1. lugal\n>>Q000002 014\n2. e2");

        CompositeRef expected = new CompositeRef("Q000002", "014");
        assertEquals(List.of(expected), document.compositeRefs());
        List<Line> lines = document.surfaces().get(0).columns().get(0).lines();
        assertEquals(expected, ((Line.ContentLine) lines.get(0)).composite());
        assertNull(((Line.ContentLine) lines.get(1)).composite());
    }

    @Test
    @DisplayName("前一行不是内容行时只记录不附着")
    void testCompositeWithoutPrecedingContent() {
        Document document = build("@obverse\n@column 1\n1. a\n$ rest broken\n>>Q000002 002");

        assertEquals(1, document.compositeRefs().size());
        Line.ContentLine line = (Line.ContentLine) document.surfaces().get(0).columns().get(0).lines().get(0);
        assertNull(line.composite());

        Document noColumn = build("@obverse\n>>Q000002 001");
        assertEquals(1, noColumn.compositeRefs().size());
    }

    @Test
    @DisplayName("表面出现之前的复合文本引用被忽略")
    void testCompositeBeforeAnySurface() {
        Document document = build(">>Q000002 001\n1. a");

        assertTrue(document.compositeRefs().isEmpty());
    }

    @Test
    @DisplayName("同语言译文覆盖，不同语言并存")
    void testInlineTranslations() {
        Document sameLanguage = build("1. a\n#tr.en: first\n#tr.en: second");
        Line.ContentLine line = firstContentLine(sameLanguage);
        assertEquals(Map.of("en", "second"), line.translations());

        Document twoLanguages = build("1. a\n#tr.en: king\n#tr.de: König");
        Line.ContentLine translated = firstContentLine(twoLanguages);
        assertEquals(List.of("en", "de"), List.copyOf(translated.translations().keySet()));
        assertEquals("König", translated.translations().get("de"));
        assertEquals(1, twoLanguages.contentLines().size());
    }

    @Test
    @DisplayName("译文跳过状态行附着到最近的内容行")
    void testTranslationSkipsStateLines() {
        Document document = build("@column 1\n1. a\n$ blank space\n#tr.en: x");

        assertEquals(Map.of("en", "x"), firstContentLine(document).translations());
    }

    @Test
    @DisplayName("没有内容行时译文被忽略")
    void testTranslationWithoutTarget() {
        assertTrue(build("#tr.en: orphan").isEmpty());
        Document document = build("@obverse\n#tr.en: orphan\n1. a");
        assertTrue(firstContentLine(document).translations().isEmpty());
    }

    @Test
    @DisplayName("头部、语言与载体类型")
    void testHeaderFields() {
        Document document = build("&P000001 = Some Tablet\n#atf: lang akk\n@prism\n@obverse\n1. a");

        assertEquals("P000001", document.header().catalogId());
        assertEquals("Some Tablet", document.header().title());
        assertEquals("akk", document.header().language());
        assertEquals("prism", document.header().objectType());
    }

    @Test
    @DisplayName("默认载体类型为 tablet")
    void testDefaultObjectType() {
        assertEquals("tablet", build("1. a").header().objectType());
    }

    @Test
    @DisplayName("注释、未知行与空行不进入文档树")
    void testDroppedLines() {
        Document document = build("# note\n\n@foo\n   \n1. a\r\n&broken header");

        assertEquals(1, document.contentLines().size());
        assertEquals("a", document.contentLines().get(0).raw());
    }

    @Test
    @DisplayName("构建后不可继续追加")
    void testBuilderIsSingleUse() {
        DocumentBuilder builder = new DocumentBuilder();
        builder.accept("1. a");
        builder.build();

        assertThrows(IllegalStateException.class, () -> builder.accept("2. b"));
    }

    private static Document build(String atf) {
        return new DocumentBuilder().acceptAll(atf).build();
    }

    private static Line.ContentLine firstContentLine(Document document) {
        return document.contentLines().get(0);
    }
}
