package com.calai.glycemic.knowledge.model;

import java.util.ArrayList;
import java.util.List;

/**
 * CSV 一列 = 一筆；數值皆為每 100g，null = 缺值（不是 0）。
 * servingSizeGrams 是「1 份」的公克數。
 */
public record FoodRecord(
        String canonicalName,
        Double glycemicIndex,
        Double carbohydrates,
        Double fiber,
        Double protein,
        Double fat,
        String processingLevel,
        Double servingSizeGrams
) {

    /** 回傳缺值欄位（CSV 欄名），空 list = 可以算 features */
    public List<String> missingFields() {
        List<String> out = new ArrayList<>(7);
        if (glycemicIndex == null) out.add("glycemic_index");
        if (carbohydrates == null) out.add("carbohydrates");
        if (fiber == null) out.add("fiber");
        if (protein == null) out.add("protein");
        if (fat == null) out.add("fat");
        if (processingLevel == null) out.add("processing_level");
        if (servingSizeGrams == null) out.add("serving_size_grams");
        return out;
    }

    public boolean isComplete() {
        return missingFields().isEmpty();
    }
}
