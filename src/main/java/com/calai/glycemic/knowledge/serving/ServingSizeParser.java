package com.calai.glycemic.knowledge.serving;

import com.calai.glycemic.knowledge.error.FoodLookupException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 份量字串 → 公克：
 * - "100g" / "100 g" / "50.5G"
 * - "1 serving" / "2.5 servings"（× 該食物的 base serving grams）
 * "serving" 先判斷，避免 "servin<g>" 被當成公克單位。
 */
public final class ServingSizeParser {
    private ServingSizeParser() {}

    public static final String DEFAULT_SERVING = "100g";

    private static final String SERVING_UNIT = "serving";
    private static final String GRAM_SUFFIX = "g";

    // 允許正負號，讓負數能被明確擋下而不是當成格式錯
    private static final Pattern AMOUNT = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)");

    public static double toGrams(String servingSpec, double baseServingGrams) {
        if (servingSpec == null) {
            throw FoodLookupException.invalidServing("null", "serving size is required");
        }
        String s = servingSpec.strip().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw FoodLookupException.invalidServing(servingSpec, "serving size is empty");
        }

        int servingAt = s.indexOf(SERVING_UNIT);
        if (servingAt >= 0) {
            double servings = parseAmount(servingSpec, s.substring(0, servingAt));
            return servings * baseServingGrams;
        }
        if (s.endsWith(GRAM_SUFFIX)) {
            return parseAmount(servingSpec, s.substring(0, s.length() - GRAM_SUFFIX.length()));
        }
        throw FoodLookupException.invalidServing(servingSpec,
                "expected '<number>g' or '<number> serving(s)'");
    }

    private static double parseAmount(String original, String numberPart) {
        String n = numberPart.strip();
        if (n.isEmpty()) {
            throw FoodLookupException.invalidServing(original, "missing amount");
        }
        if (!AMOUNT.matcher(n).matches()) {
            throw FoodLookupException.invalidServing(original, "'" + n + "' is not a number");
        }
        double v = Double.parseDouble(n);
        if (!Double.isFinite(v)) {
            throw FoodLookupException.invalidServing(original, "amount out of range");
        }
        if (v < 0) {
            throw FoodLookupException.invalidServing(original, "amount must not be negative");
        }
        // -0 → 0
        return v == 0.0 ? 0.0 : v;
    }
}
