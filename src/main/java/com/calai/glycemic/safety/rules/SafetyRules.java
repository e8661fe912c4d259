package com.calai.glycemic.safety.rules;

import com.calai.glycemic.knowledge.model.NutritionFeatures;
import com.calai.glycemic.safety.model.SafetyLabel;
import com.calai.glycemic.safety.model.SafetyVerdict;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 命題式規則：GL、GI 各自分級，再取最嚴重者。
 * 純計算，沒有 I/O；同一組 features 永遠得到同一個 verdict（含 explanation 字串）。
 */
public class SafetyRules {

    private final SafetyThresholds thresholds;

    public SafetyRules(SafetyThresholds thresholds) {
        this.thresholds = thresholds == null ? SafetyThresholds.DEFAULTS : thresholds;
    }

    public SafetyThresholds thresholds() {
        return thresholds;
    }

    /** 門檻值本身屬於較低嚴重度那一級 */
    public static SafetyLabel categorize(double value, double safeThreshold, double cautionThreshold) {
        if (value <= safeThreshold) return SafetyLabel.SAFE;
        if (value <= cautionThreshold) return SafetyLabel.CAUTION;
        return SafetyLabel.UNSAFE;
    }

    public SafetyVerdict evaluate(NutritionFeatures features) {
        double gl = features.glycemicLoad();
        double gi = features.glycemicIndex();

        SafetyLabel glCategory = categorize(gl, thresholds.safeGl(), thresholds.cautionGl());
        SafetyLabel giCategory = categorize(gi, thresholds.safeGi(), thresholds.cautionGi());
        SafetyLabel label = SafetyLabel.mostSevere(glCategory, giCategory);

        String explanation = sentence("Glycemic load", gl, glCategory, thresholds.safeGl(), thresholds.cautionGl())
                + " "
                + sentence("Glycemic index", gi, giCategory, thresholds.safeGi(), thresholds.cautionGi());

        return new SafetyVerdict(label, explanation, glCategory, giCategory);
    }

    // e.g. "Glycemic load 1.2 is within the safe range (safe <= 10, caution <= 20)."
    private static String sentence(String axis, double value, SafetyLabel band, double safe, double caution) {
        String where = switch (band) {
            case SAFE -> "is within the safe range";
            case CAUTION -> "exceeds the safe threshold and is within the caution range";
            case UNSAFE -> "exceeds the caution threshold and is unsafe";
        };
        return axis + " " + fmt(value) + " " + where
                + " (safe <= " + fmt(safe) + ", caution <= " + fmt(caution) + ").";
    }

    static String fmt(double v) {
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }
}
