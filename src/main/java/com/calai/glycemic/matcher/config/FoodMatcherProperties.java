package com.calai.glycemic.matcher.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * application.yml:
 * glycemic.matcher.*
 */
@Validated
@ConfigurationProperties(prefix = "glycemic.matcher")
public class FoodMatcherProperties {

    /** 關掉就只用子字串比對（例如測試環境不想載 ONNX） */
    private boolean embeddingsEnabled = true;

    /** 預先計算 corpus embedding 的批次大小 */
    @Min(1)
    private int batchSize = 32;

    /** API 沒帶 topK 時的每頁筆數 */
    @Min(1)
    private int defaultTopK = 5;

    /** topK 上限（避免一次要整個 corpus） */
    @Min(1) @Max(500)
    private int maxTopK = 50;

    // ===== getters/setters =====
    public boolean isEmbeddingsEnabled() { return embeddingsEnabled; }
    public void setEmbeddingsEnabled(boolean embeddingsEnabled) { this.embeddingsEnabled = embeddingsEnabled; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public int getDefaultTopK() { return defaultTopK; }
    public void setDefaultTopK(int defaultTopK) { this.defaultTopK = defaultTopK; }

    public int getMaxTopK() { return maxTopK; }
    public void setMaxTopK(int maxTopK) { this.maxTopK = maxTopK; }
}
