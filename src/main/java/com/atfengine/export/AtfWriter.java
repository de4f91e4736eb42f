package com.atfengine.export;

import com.atfengine.document.Column;
import com.atfengine.document.CompositeRef;
import com.atfengine.document.Document;
import com.atfengine.document.Header;
import com.atfengine.document.Line;
import com.atfengine.document.Surface;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 将文档树重新输出为规范化的 ATF 文本，再次解析可得到相同的结构与词元序列。
 */
public class AtfWriter {

    public String write(Document document) {
        if (document == null) {
            return "";
        }
        return String.join("\n", toLines(document));
    }

    public List<String> toLines(Document document) {
        List<String> lines = new ArrayList<>();
        writeHeader(document.header(), lines);

        for (Surface surface : document.surfaces()) {
            lines.add(surfaceDirective(surface));
            for (Line.StateLine state : surface.states()) {
                lines.add(stateLine(state));
            }
            for (Column column : surface.columns()) {
                if (!column.implicit()) {
                    lines.add("@column " + column.number());
                }
                for (Line line : column.lines()) {
                    writeLine(line, lines);
                }
            }
        }
        return lines;
    }

    private void writeHeader(Header header, List<String> lines) {
        if (header == null) {
            return;
        }
        if (header.catalogId() != null) {
            String title = header.title() == null ? "" : header.title();
            lines.add("&" + header.catalogId() + " = " + title);
        }
        if (header.language() != null) {
            lines.add("#atf: lang " + header.language());
        }
        if (header.objectType() != null) {
            lines.add("@" + header.objectType());
        }
    }

    private void writeLine(Line line, List<String> lines) {
        if (line instanceof Line.StateLine state) {
            lines.add(stateLine(state));
            return;
        }
        Line.ContentLine content = (Line.ContentLine) line;
        lines.add(content.number().isEmpty() ? content.raw() : content.number() + " " + content.raw());

        CompositeRef composite = content.composite();
        if (composite != null) {
            lines.add(">>" + composite.compositeId() + " " + composite.lineRef());
        }
        for (Map.Entry<String, String> translation : content.translations().entrySet()) {
            lines.add("#tr." + translation.getKey() + ": " + translation.getValue());
        }
    }

    private String surfaceDirective(Surface surface) {
        String directive = "@" + surface.name();
        if (surface.modifier() != null) {
            directive += " " + surface.modifier();
        }
        return directive;
    }

    private String stateLine(Line.StateLine state) {
        return "$ " + state.text();
    }
}
