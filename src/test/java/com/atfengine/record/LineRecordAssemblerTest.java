package com.atfengine.record;

import com.atfengine.document.CompositeRef;
import com.atfengine.document.Document;
import com.atfengine.document.Line;
import com.atfengine.document.Surface;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LineRecordAssemblerTest {

    private final LineRecordAssembler assembler = new LineRecordAssembler();

    @Test
    @DisplayName("按表面与栏号分组并保持首次出现顺序")
    void testGroupingAndLineKinds() {
        List<LineRecord> records = List.of(
            LineRecord.content("obverse", 0, "1", "lugal e2"),
            LineRecord.content("obverse", 0, "2.", "a >>Q000002 003"),
            new LineRecord(null, "$ rest broken", false, false, null, 0),
            LineRecord.content("reverse", 1, "1'", "b"),
            new LineRecord("2'", "", true, false, "reverse", 2),
            new LineRecord("3'", null, false, true, "reverse", 2),
            new LineRecord("4'", "blank space", false, true, "reverse", 2)
        );

        Document document = assembler.assemble(records);

        assertEquals(2, document.surfaces().size());
        assertTrue(document.hasMultipleSurfaces());
        assertTrue(document.hasMultipleColumns());

        Surface obverse = document.surfaces().get(0);
        assertEquals("Obverse", obverse.label());
        List<Line> obverseLines = obverse.columns().get(0).lines();
        assertEquals(3, obverseLines.size());

        Line.ContentLine first = assertInstanceOf(Line.ContentLine.class, obverseLines.get(0));
        assertEquals("1.", first.number());
        assertEquals(2, first.words().size());
        assertNull(first.composite());

        Line.ContentLine second = assertInstanceOf(Line.ContentLine.class, obverseLines.get(1));
        assertEquals("2.", second.number());
        assertEquals("a >>Q000002 003", second.raw());
        assertEquals(1, second.words().size());
        assertEquals(new CompositeRef("Q000002", "003"), second.composite());
        assertEquals(List.of(new CompositeRef("Q000002", "003")), document.compositeRefs());

        assertEquals(new Line.StateLine("rest broken"), obverseLines.get(2));

        Surface reverse = document.surfaces().get(1);
        assertEquals(List.of(1, 2), List.of(reverse.columns().get(0).number(), reverse.columns().get(1).number()));
        Line.ContentLine primed = assertInstanceOf(Line.ContentLine.class, reverse.columns().get(0).lines().get(0));
        assertTrue(primed.prime());
        assertEquals("1'.", primed.number());
        assertEquals(
            List.of(new Line.StateLine("ruling"), new Line.StateLine("blank space")),
            reverse.columns().get(1).lines());
    }

    @Test
    @DisplayName("未登记的表面类型转为标题格式")
    void testSurfaceLabels() {
        Document document = assembler.assemble(List.of(
            LineRecord.content("left_edge", 0, "1", "a"),
            LineRecord.content("bottom_side", 0, "1", "b")
        ));

        assertEquals("Left Edge", document.surfaces().get(0).label());
        assertEquals("Bottom Side", document.surfaces().get(1).label());
        assertFalse(document.hasMultipleColumns());
    }

    @Test
    @DisplayName("无行号的内容行标签为空")
    void testEmptyLineNumber() {
        Document document = assembler.assemble(List.of(LineRecord.content(null, 0, null, "a-na")));

        Line.ContentLine line = document.contentLines().get(0);
        assertEquals("", line.number());
        assertFalse(line.prime());
        assertEquals("obverse", document.surfaces().get(0).name());
    }

    @Test
    void testEmptyInput() {
        assertTrue(assembler.assemble(List.of()).isEmpty());
        assertTrue(assembler.assemble(null).isEmpty());
        assertEquals("tablet", assembler.assemble(null).header().objectType());
    }
}
