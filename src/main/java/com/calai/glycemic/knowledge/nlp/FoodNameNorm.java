package com.calai.glycemic.knowledge.nlp;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 食物名稱正規化（載入與查詢共用同一份）：
 * 1) toLowerCase(ROOT)
 * 2) 壓縮空白（含 tab / 全形空白）
 * 3) 去頭尾空白
 * 不去標點、不去重音："gluten-free" 與 "gluten free" 是不同 key。
 */
public final class FoodNameNorm {
    private FoodNameNorm() {}

    private static final Pattern WHITESPACE_RUN =
            Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    public static String normalize(String name) {
        if (name == null || name.isEmpty()) return "";
        String lower = name.toLowerCase(Locale.ROOT);
        return WHITESPACE_RUN.matcher(lower).replaceAll(" ").strip();
    }
}
