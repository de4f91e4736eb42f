package com.atfengine.text;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 内容行中的一个词元，共五种。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Word.Punctuation.class, name = "punctuation"),
    @JsonSubTypes.Type(value = Word.Broken.class, name = "broken"),
    @JsonSubTypes.Type(value = Word.Logogram.class, name = "logogram"),
    @JsonSubTypes.Type(value = Word.DeterminativeWord.class, name = "determinative"),
    @JsonSubTypes.Type(value = Word.Plain.class, name = "word")
})
public sealed interface Word permits Word.Punctuation, Word.Broken, Word.Logogram,
        Word.DeterminativeWord, Word.Plain {

    /** 展示文本 */
    String text();

    /** 词典查询键，不参与查询的词元返回 null */
    String lookup();

    /** 限定符相对所附词的位置 */
    enum Position {
        @JsonProperty("prefix")
        PREFIX,
        @JsonProperty("suffix")
        SUFFIX
    }

    record Punctuation(String text) implements Word {
        @Override
        public String lookup() {
            return null;
        }
    }

    /**
     * 方括号内的残损片段，text 含括号，inner 为去括号后的内容。
     */
    record Broken(String text, String inner) implements Word {
        @Override
        public String lookup() {
            return null;
        }
    }

    record Logogram(String text, String lookup) implements Word {
    }

    record DeterminativeWord(
            String text,
            String lookup,
            String code,
            Determinative determinative,
            Position position
    ) implements Word {
    }

    /**
     * 普通词。text 为去掉尾部标记后的文本，raw 保留原始写法。
     */
    record Plain(
            String text,
            String raw,
            String lookup,
            boolean damaged,
            boolean uncertain,
            boolean corrected
    ) implements Word {
    }
}
