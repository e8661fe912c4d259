package com.calai.glycemic.knowledge.model;

/**
 * 某一份量下的營養特徵（每次查詢現算，不快取）。
 * glycemicIndex 不隨份量縮放；其餘 macro 以 grams/100 線性縮放。
 */
public record NutritionFeatures(
        double glycemicIndex,
        double glycemicLoad,
        double carbohydrates,
        double fiber,
        double protein,
        double fat,
        String processingLevel,
        double servingSizeGrams
) {}
