package com.calai.glycemic.knowledge.config;

/** CSV 內正規化後同名的處理方式 */
public enum DuplicatePolicy {
    /** 後面覆蓋前面，WARN 一次 */
    LAST_WINS,
    /** 有重複就拒絕載入 */
    REJECT
}
