package com.atfengine.record;

/**
 * 存储层中已拆分的一行转写记录。
 *
 * @param lineNumber   行号标签，如 "3" 或 "3'."，可为 null
 * @param rawAtf       该行原始 ATF 文本，可为 null
 * @param ruling       是否为划线行
 * @param blank        是否为空白行
 * @param surfaceType  表面类型，null 时视为 obverse
 * @param columnNumber 栏号，0 表示隐式栏
 */
public record LineRecord(
        String lineNumber,
        String rawAtf,
        boolean ruling,
        boolean blank,
        String surfaceType,
        int columnNumber
) {
    public static LineRecord content(String surfaceType, int columnNumber, String lineNumber, String rawAtf) {
        return new LineRecord(lineNumber, rawAtf, false, false, surfaceType, columnNumber);
    }
}
