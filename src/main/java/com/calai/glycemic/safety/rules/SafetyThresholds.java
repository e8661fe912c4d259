package com.calai.glycemic.safety.rules;

/**
 * 兩軸門檻：value <= safe → SAFE；<= caution → CAUTION；其餘 UNSAFE
 */
public record SafetyThresholds(double safeGl, double cautionGl, double safeGi, double cautionGi) {

    public static final SafetyThresholds DEFAULTS = new SafetyThresholds(10.0, 20.0, 55.0, 70.0);

    public SafetyThresholds {
        requireBand("glycemic load", safeGl, cautionGl);
        requireBand("glycemic index", safeGi, cautionGi);
    }

    private static void requireBand(String axis, double safe, double caution) {
        if (!Double.isFinite(safe) || !Double.isFinite(caution) || safe < 0 || caution < 0) {
            throw new IllegalArgumentException(axis + " thresholds must be finite and non-negative: safe="
                    + safe + ", caution=" + caution);
        }
        if (safe > caution) {
            throw new IllegalArgumentException(axis + " safe threshold (" + safe
                    + ") must not exceed caution threshold (" + caution + ")");
        }
    }
}
