package com.atfengine.document;

import com.atfengine.text.Word;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Line.StateLine.class, name = "state"),
    @JsonSubTypes.Type(value = Line.ContentLine.class, name = "content")
})
public sealed interface Line permits Line.StateLine, Line.ContentLine {

    /**
     * 状态行，例如 "beginning broken"，不编号。
     */
    record StateLine(String text) implements Line {
    }

    /**
     * 内容行。composite 可为 null；translations 以语言代码为键并保持插入顺序。
     */
    record ContentLine(
            String number,
            boolean prime,
            String raw,
            List<Word> words,
            CompositeRef composite,
            Map<String, String> translations
    ) implements Line {

        public ContentLine {
            words = words == null ? List.of() : List.copyOf(words);
            translations = translations == null || translations.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(translations));
        }

        public ContentLine(String number, boolean prime, String raw, List<Word> words) {
            this(number, prime, raw, words, null, Map.of());
        }

        public ContentLine withComposite(CompositeRef compositeRef) {
            return new ContentLine(number, prime, raw, words, compositeRef, translations);
        }

        /**
         * 返回新增（或覆盖）指定语言译文后的副本。
         */
        public ContentLine withTranslation(String language, String text) {
            Map<String, String> merged = new LinkedHashMap<>(translations);
            merged.put(language, text);
            return new ContentLine(number, prime, raw, words, composite, merged);
        }
    }
}
