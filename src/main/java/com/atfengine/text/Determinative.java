package com.atfengine.text;

/**
 * 限定符的解析结果：语义类型、可读标签与上标字形。
 */
public record Determinative(String type, String label, String glyph) {

    public static final String OTHER_TYPE = "other";

    /**
     * 未登记的限定符代码降级为 other 类型，标签即代码本身。
     */
    public static Determinative unknown(String code) {
        return new Determinative(OTHER_TYPE, code, "(" + code + ")");
    }
}
