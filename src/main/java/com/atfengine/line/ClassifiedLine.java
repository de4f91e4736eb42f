package com.atfengine.line;

import com.atfengine.document.CompositeRef;

/**
 * 单行分类结果。
 */
public sealed interface ClassifiedLine permits ClassifiedLine.Header, ClassifiedLine.Language,
        ClassifiedLine.Translation, ClassifiedLine.Comment, ClassifiedLine.ObjectType,
        ClassifiedLine.Surface, ClassifiedLine.Column, ClassifiedLine.State,
        ClassifiedLine.Composite, ClassifiedLine.Content, ClassifiedLine.Unknown {

    /** {@code &P000001 = title} */
    record Header(String catalogId, String title) implements ClassifiedLine {
    }

    /** {@code #atf: lang sux} */
    record Language(String language) implements ClassifiedLine {
    }

    /** {@code #tr.en: text}，附着到上一条内容行 */
    record Translation(String language, String text) implements ClassifiedLine {
    }

    record Comment(String text) implements ClassifiedLine {
    }

    record ObjectType(String objectType) implements ClassifiedLine {
    }

    /** modifier 可为 null */
    record Surface(String name, String modifier) implements ClassifiedLine {
    }

    record Column(int number) implements ClassifiedLine {
    }

    record State(String text) implements ClassifiedLine {
    }

    record Composite(CompositeRef ref) implements ClassifiedLine {
    }

    /** 无编号内容行的 number 为空字符串 */
    record Content(String number, String raw, boolean prime) implements ClassifiedLine {
    }

    record Unknown(String raw) implements ClassifiedLine {
    }
}
