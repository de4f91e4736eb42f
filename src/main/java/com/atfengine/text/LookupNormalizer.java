package com.atfengine.text;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 将词的展示文本规范化为词典查询键。
 *
 * <p>纯函数：相同输入总是得到相同输出，词典缓存依赖这一点。
 */
public final class LookupNormalizer {

    private static final Pattern MARKERS = Pattern.compile("[#?!*]");
    private static final Pattern SUBSCRIPT_DIGITS = Pattern.compile("[₀-₉]");
    private static final Pattern SIGN_VARIANTS = Pattern.compile("[~@][a-z0-9]+");
    private static final Pattern COMPLEX_SIGN_NOTATION = Pattern.compile("[|x]");

    private LookupNormalizer() {
    }

    /**
     * 依次去除残留标记、下标数字、符号变体注记与复合符号记法，再转小写。
     *
     * @param word 词的展示文本
     * @return 查询键；规范化后为空时返回 null
     */
    public static String normalize(String word) {
        if (word == null || word.isEmpty()) {
            return null;
        }

        String normalized = MARKERS.matcher(word).replaceAll("");
        normalized = SUBSCRIPT_DIGITS.matcher(normalized).replaceAll("");
        normalized = SIGN_VARIANTS.matcher(normalized).replaceAll("");
        normalized = COMPLEX_SIGN_NOTATION.matcher(normalized).replaceAll("");
        normalized = normalized.toLowerCase(Locale.ROOT);

        return normalized.isEmpty() ? null : normalized;
    }
}
