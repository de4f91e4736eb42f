package com.atfengine.document;

import java.util.List;

/**
 * 表面上的一栏。implicit 为 true 表示未声明 @column 时自动创建的栏，编号为 0。
 */
public record Column(int number, boolean implicit, List<Line> lines) {

    public Column {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }
}
