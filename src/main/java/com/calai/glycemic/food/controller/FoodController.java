package com.calai.glycemic.food.controller;

import com.calai.glycemic.food.dto.FoodNamesResponse;
import com.calai.glycemic.food.dto.FoodSafetyResponse;
import com.calai.glycemic.knowledge.model.NutritionFeatures;
import com.calai.glycemic.knowledge.serving.ServingSizeParser;
import com.calai.glycemic.knowledge.service.NutritionKnowledgeBase;
import com.calai.glycemic.matcher.FoodNameMatcher;
import com.calai.glycemic.matcher.config.FoodMatcherProperties;
import com.calai.glycemic.matcher.model.FoodMatchResult;
import com.calai.glycemic.safety.service.FoodSafetyEngine;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/foods")
public class FoodController {

    private final NutritionKnowledgeBase knowledgeBase;
    private final FoodNameMatcher matcher;
    private final FoodSafetyEngine safetyEngine;
    private final FoodMatcherProperties matcherProps;

    public FoodController(NutritionKnowledgeBase knowledgeBase,
                          FoodNameMatcher matcher,
                          FoodSafetyEngine safetyEngine,
                          FoodMatcherProperties matcherProps) {
        this.knowledgeBase = knowledgeBase;
        this.matcher = matcher;
        this.safetyEngine = safetyEngine;
        this.matcherProps = matcherProps;
    }

    /** 全部 canonical 名稱 */
    @GetMapping
    public FoodNamesResponse names() {
        var names = knowledgeBase.listNames();
        return new FoodNamesResponse(names.size(), names);
    }

    /** 名稱解析：exact 直接回；否則回一頁候選（下一頁帶 nextOffset） */
    @GetMapping("/match")
    public FoodMatchResult match(
            @RequestParam("q") String query,
            @RequestParam(value = "topK", required = false) Integer topK,
            @RequestParam(value = "offset", defaultValue = "0") int offset
    ) {
        int k = (topK == null) ? matcherProps.getDefaultTopK() : topK;
        if (k > matcherProps.getMaxTopK()) throw new IllegalArgumentException("TOP_K_TOO_LARGE");
        if (k < 1) throw new IllegalArgumentException("TOP_K_INVALID");
        if (offset < 0) throw new IllegalArgumentException("OFFSET_INVALID");
        return matcher.resolve(query, k, offset);
    }

    @GetMapping("/features")
    public NutritionFeatures features(
            @RequestParam("name") String name,
            @RequestParam(value = "serving", defaultValue = ServingSizeParser.DEFAULT_SERVING) String serving
    ) {
        return knowledgeBase.getFeatures(name, serving);
    }

    @GetMapping("/safety")
    public FoodSafetyResponse safety(
            @RequestParam("name") String name,
            @RequestParam(value = "serving", defaultValue = ServingSizeParser.DEFAULT_SERVING) String serving
    ) {
        return FoodSafetyResponse.from(safetyEngine.assess(name, serving));
    }
}
