package com.calai.glycemic.safety.config;

import com.calai.glycemic.safety.rules.SafetyThresholds;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * application.yml:
 * glycemic.safety.*
 */
@ConfigurationProperties(prefix = "glycemic.safety")
public class SafetyThresholdsProperties {

    /** GL <= safeGl → safe */
    private double safeGl = SafetyThresholds.DEFAULTS.safeGl();

    /** safeGl < GL <= cautionGl → caution；再高 → unsafe */
    private double cautionGl = SafetyThresholds.DEFAULTS.cautionGl();

    /** GI <= safeGi → safe */
    private double safeGi = SafetyThresholds.DEFAULTS.safeGi();

    /** safeGi < GI <= cautionGi → caution；再高 → unsafe */
    private double cautionGi = SafetyThresholds.DEFAULTS.cautionGi();

    /** 轉成不可變門檻（順便驗證 safe <= caution） */
    public SafetyThresholds toThresholds() {
        return new SafetyThresholds(safeGl, cautionGl, safeGi, cautionGi);
    }

    // ===== getters/setters =====
    public double getSafeGl() { return safeGl; }
    public void setSafeGl(double safeGl) { this.safeGl = safeGl; }

    public double getCautionGl() { return cautionGl; }
    public void setCautionGl(double cautionGl) { this.cautionGl = cautionGl; }

    public double getSafeGi() { return safeGi; }
    public void setSafeGi(double safeGi) { this.safeGi = safeGi; }

    public double getCautionGi() { return cautionGi; }
    public void setCautionGi(double cautionGi) { this.cautionGi = cautionGi; }
}
