package com.calai.glycemic.food.dto;

import com.calai.glycemic.knowledge.model.NutritionFeatures;
import com.calai.glycemic.safety.model.SafetyVerdict;
import com.calai.glycemic.safety.service.FoodSafetyEngine;

public record FoodSafetyResponse(String food, NutritionFeatures features, SafetyVerdict verdict) {

    public static FoodSafetyResponse from(FoodSafetyEngine.Assessment a) {
        return new FoodSafetyResponse(a.food(), a.features(), a.verdict());
    }
}
