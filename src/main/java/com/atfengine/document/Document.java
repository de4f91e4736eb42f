package com.atfengine.document;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次解析得到的完整转写文档，返回后不可变。
 */
public record Document(
        Header header,
        List<Surface> surfaces,
        List<CompositeRef> compositeRefs,
        boolean hasMultipleSurfaces,
        boolean hasMultipleColumns
) {
    public Document {
        surfaces = surfaces == null ? List.of() : List.copyOf(surfaces);
        compositeRefs = compositeRefs == null ? List.of() : List.copyOf(compositeRefs);
    }

    /**
     * 没有任何表面时视为空文档，展示层据此显示“无转写”状态。
     */
    @JsonIgnore
    public boolean isEmpty() {
        return surfaces.isEmpty();
    }

    /**
     * 按表面、栏目顺序收集全部内容行。
     */
    public List<Line.ContentLine> contentLines() {
        List<Line.ContentLine> contentLines = new ArrayList<>();
        for (Surface surface : surfaces) {
            for (Column column : surface.columns()) {
                for (Line line : column.lines()) {
                    if (line instanceof Line.ContentLine contentLine) {
                        contentLines.add(contentLine);
                    }
                }
            }
        }
        return contentLines;
    }

    /**
     * 计算多栏标记：任一表面多于一栏，或任一栏的声明编号大于 1。
     */
    public static boolean computeMultipleColumns(List<Surface> surfaces) {
        for (Surface surface : surfaces) {
            if (surface.columns().size() > 1) {
                return true;
            }
            for (Column column : surface.columns()) {
                if (column.number() > 1) {
                    return true;
                }
            }
        }
        return false;
    }
}
