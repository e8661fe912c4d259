package com.calai.glycemic.matcher.model;

public enum MatchMode {
    /** 正規化後直接命中 canonical key，不做相似度搜尋 */
    EXACT,
    /** cosine similarity over precomputed embeddings */
    EMBEDDING,
    /** 沒有 embedding 能力時的子字串比對 */
    SUBSTRING
}
