package com.atfengine.document;

/**
 * 对复合文本（Q 编号）某一行的引用。
 */
public record CompositeRef(String compositeId, String lineRef) {
}
