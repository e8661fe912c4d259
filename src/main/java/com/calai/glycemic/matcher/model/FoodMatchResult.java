package com.calai.glycemic.matcher.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * exactMatch 有值 → candidates 為空、不需再讓使用者選。
 * nextOffset = null 代表已經沒有下一頁。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FoodMatchResult(
        String query,
        String exactMatch,
        List<FoodCandidate> candidates,
        int offset,
        int topK,
        Integer nextOffset,
        MatchMode mode
) {

    public static FoodMatchResult exact(String query, String name) {
        return new FoodMatchResult(query, name, List.of(), 0, 1, null, MatchMode.EXACT);
    }

    public boolean isExact() {
        return exactMatch != null;
    }
}
