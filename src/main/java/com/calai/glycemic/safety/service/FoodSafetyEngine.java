package com.calai.glycemic.safety.service;

import com.calai.glycemic.knowledge.model.NutritionFeatures;
import com.calai.glycemic.knowledge.serving.ServingSizeParser;
import com.calai.glycemic.knowledge.service.NutritionKnowledgeBase;
import com.calai.glycemic.safety.model.SafetyVerdict;
import com.calai.glycemic.safety.rules.SafetyRules;
import org.springframework.stereotype.Service;

/**
 * 知識庫 → 規則引擎。
 * NOT_FOUND / MISSING_DATA / INVALID_SERVING_FORMAT 原樣往上丟，不重試、不吞。
 */
@Service
public class FoodSafetyEngine {

    private final NutritionKnowledgeBase knowledgeBase;
    private final SafetyRules rules;

    public FoodSafetyEngine(NutritionKnowledgeBase knowledgeBase, SafetyRules rules) {
        if (knowledgeBase == null) throw new IllegalArgumentException("knowledgeBase is required");
        if (rules == null) throw new IllegalArgumentException("rules is required");
        this.knowledgeBase = knowledgeBase;
        this.rules = rules;
    }

    public SafetyVerdict evaluate(NutritionFeatures features) {
        return rules.evaluate(features);
    }

    public SafetyVerdict evaluateFood(String foodName) {
        return evaluateFood(foodName, ServingSizeParser.DEFAULT_SERVING);
    }

    public SafetyVerdict evaluateFood(String foodName, String servingSpec) {
        return assess(foodName, servingSpec).verdict();
    }

    /** 同一次計算同時回 features 與 verdict（API 要兩個都顯示） */
    public Assessment assess(String foodName, String servingSpec) {
        NutritionFeatures features = knowledgeBase.getFeatures(foodName, servingSpec);
        return new Assessment(NutritionKnowledgeBase.normalize(foodName), features, rules.evaluate(features));
    }

    public record Assessment(String food, NutritionFeatures features, SafetyVerdict verdict) {}
}
