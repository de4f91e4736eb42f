package com.atfengine.text;

import java.util.ArrayList;
import java.util.List;

/**
 * 将一条内容行的原始文本切分为有序词元。
 *
 * <p>不会因输入不规范而失败：未闭合的括号或下划线退化为普通词字符扫描，
 * 无法识别的字符逐个跳过。
 */
public class WordTokenizer {

    private static final String PUNCTUATION = ",.;:";
    private static final String DIACRITICS = "šṣṭāēīūâêîûŠṢṬĀĒĪŪÂÊÎÛ";
    private static final String MARKER_CHARS = "-~@|#?!";
    private static final String TRAILING_MARKERS = "#?!";

    /**
     * 从左到右扫描文本，跳过词元之间的空白。
     */
    public List<Word> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Word> words = new ArrayList<>();
        int index = 0;
        while (index < text.length()) {
            if (Character.isWhitespace(text.charAt(index))) {
                index++;
                continue;
            }
            index = readWord(text, index, words);
        }
        return List.copyOf(words);
    }

    /**
     * 读取当前位置的一个词元并追加，返回下一个扫描位置。
     */
    private int readWord(String text, int start, List<Word> words) {
        char currentChar = text.charAt(start);

        if (PUNCTUATION.indexOf(currentChar) >= 0) {
            words.add(new Word.Punctuation(String.valueOf(currentChar)));
            return start + 1;
        }

        if (currentChar == '[') {
            int end = text.indexOf(']', start);
            if (end >= 0) {
                String content = text.substring(start, end + 1);
                words.add(new Word.Broken(content, stripBrackets(content)));
                return end + 1;
            }
        }

        if (currentChar == '_') {
            int end = text.indexOf('_', start + 1);
            if (end >= 0) {
                String content = text.substring(start + 1, end);
                words.add(new Word.Logogram(content, LookupNormalizer.normalize(content)));
                return end + 1;
            }
        }

        if (currentChar == '{') {
            int end = text.indexOf('}', start);
            if (end >= 0) {
                String code = text.substring(start + 1, end);
                int wordEnd = scanWordChars(text, end + 1);
                String following = text.substring(end + 1, wordEnd);
                words.add(determinative(following, code, Word.Position.PREFIX));
                return wordEnd;
            }
        }

        int wordEnd = scanWordChars(text, start);
        if (wordEnd == start) {
            // 无法识别的字符直接丢弃
            return start + 1;
        }
        String word = text.substring(start, wordEnd);

        if (wordEnd < text.length() && text.charAt(wordEnd) == '{') {
            int end = text.indexOf('}', wordEnd);
            if (end >= 0) {
                String code = text.substring(wordEnd + 1, end);
                words.add(determinative(word, code, Word.Position.SUFFIX));
                return end + 1;
            }
        }

        words.add(plainWord(word));
        return wordEnd;
    }

    /**
     * 剥离词尾的标记串：依次消费 # 残损、? 存疑、! 校正，不符合该顺序的标记保留在词中。
     */
    private Word.Plain plainWord(String word) {
        int markerStart = word.length();
        while (markerStart > 0 && TRAILING_MARKERS.indexOf(word.charAt(markerStart - 1)) >= 0) {
            markerStart--;
        }

        int index = markerStart;
        int afterDamaged = skipRun(word, index, '#');
        boolean damaged = afterDamaged > index;
        index = afterDamaged;
        int afterUncertain = skipRun(word, index, '?');
        boolean uncertain = afterUncertain > index;
        index = afterUncertain;
        int afterCorrected = skipRun(word, index, '!');
        boolean corrected = afterCorrected > index;
        index = afterCorrected;

        String clean = word.substring(0, markerStart) + word.substring(index);
        return new Word.Plain(clean, word, LookupNormalizer.normalize(clean), damaged, uncertain, corrected);
    }

    private Word.DeterminativeWord determinative(String word, String code, Word.Position position) {
        return new Word.DeterminativeWord(
            word,
            LookupNormalizer.normalize(word),
            code,
            Determinatives.resolve(code),
            position
        );
    }

    /**
     * 返回从 start 起连续词字符之后的位置。
     */
    private int scanWordChars(String text, int start) {
        int index = start;
        while (index < text.length() && isWordChar(text.charAt(index))) {
            index++;
        }
        return index;
    }

    static boolean isWordChar(char ch) {
        return (ch >= 'a' && ch <= 'z')
            || (ch >= 'A' && ch <= 'Z')
            || (ch >= '0' && ch <= '9')
            || (ch >= '₀' && ch <= '₉')
            || DIACRITICS.indexOf(ch) >= 0
            || MARKER_CHARS.indexOf(ch) >= 0;
    }

    private static int skipRun(String value, int start, char marker) {
        int index = start;
        while (index < value.length() && value.charAt(index) == marker) {
            index++;
        }
        return index;
    }

    private static String stripBrackets(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && (value.charAt(start) == '[' || value.charAt(start) == ']')) {
            start++;
        }
        while (end > start && (value.charAt(end - 1) == '[' || value.charAt(end - 1) == ']')) {
            end--;
        }
        return value.substring(start, end);
    }
}
