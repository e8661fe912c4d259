package com.calai.glycemic.knowledge.service;

import com.calai.glycemic.knowledge.config.DuplicatePolicy;
import com.calai.glycemic.knowledge.error.FoodLookupException;
import com.calai.glycemic.knowledge.model.FoodRecord;
import com.calai.glycemic.knowledge.model.NutritionFeatures;
import com.calai.glycemic.knowledge.nlp.FoodNameNorm;
import com.calai.glycemic.knowledge.serving.ServingSizeParser;
import com.calai.glycemic.knowledge.source.NutritionCsvReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 營養知識庫：正規化食物名 → 每 100g 營養資料。
 * <p>
 * 建構後完全唯讀（map / list 皆為 unmodifiable），多執行緒同時查詢不需同步。
 * 缺值不在載入時擋，查詢 features 時才丟 MISSING_DATA。
 */
@Slf4j
public class NutritionKnowledgeBase {

    private final Map<String, FoodRecord> foods;
    private final List<String> names;
    private final Set<String> duplicateNames;

    public NutritionKnowledgeBase(List<FoodRecord> records, DuplicatePolicy policy) {
        Map<String, FoodRecord> byName = new LinkedHashMap<>(Math.max(16, records.size() * 2));
        Set<String> dups = new LinkedHashSet<>();

        for (FoodRecord r : records) {
            // CSV reader 已正規化；這裡再做一次，直接 new 的 record 也能用同一套 key
            String key = FoodNameNorm.normalize(r.canonicalName());
            if (key.isEmpty()) continue;
            FoodRecord normalized = key.equals(r.canonicalName()) ? r : withName(r, key);
            if (byName.containsKey(key)) {
                dups.add(key);
                // LAST_WINS：移除後再放，listNames 的順序跟著最後一筆
                byName.remove(key);
            }
            byName.put(key, normalized);
        }

        if (!dups.isEmpty()) {
            if (policy == DuplicatePolicy.REJECT) {
                throw FoodLookupException.sourceUnavailable("nutrition records",
                        dups.size() + " duplicate food name(s): " + preview(dups));
            }
            log.warn("[KnowledgeBase] {} duplicate food name(s), last row wins: {}", dups.size(), preview(dups));
        }

        this.foods = Collections.unmodifiableMap(byName);
        this.names = List.copyOf(byName.keySet());
        this.duplicateNames = Collections.unmodifiableSet(dups);
    }

    public static NutritionKnowledgeBase load(Resource source, DuplicatePolicy policy) {
        NutritionKnowledgeBase kb = new NutritionKnowledgeBase(NutritionCsvReader.read(source), policy);
        long incomplete = kb.foods.values().stream().filter(r -> !r.isComplete()).count();
        log.info("[KnowledgeBase] loaded {} foods from {} ({} incomplete)",
                kb.size(), source.getDescription(), incomplete);
        return kb;
    }

    public static String normalize(String name) {
        return FoodNameNorm.normalize(name);
    }

    /** 全部 canonical key（CSV 順序） */
    public List<String> listNames() {
        return names;
    }

    /** 全部資料（唯讀 view，外部改不動） */
    public Map<String, FoodRecord> getAllFoods() {
        return foods;
    }

    /** 載入時看到的重複 key（LAST_WINS 時才可能非空） */
    public Set<String> duplicateNames() {
        return duplicateNames;
    }

    public int size() {
        return foods.size();
    }

    public boolean contains(String name) {
        return foods.containsKey(normalize(name));
    }

    public Optional<FoodRecord> find(String name) {
        return Optional.ofNullable(foods.get(normalize(name)));
    }

    public NutritionFeatures getFeatures(String foodName) {
        return getFeatures(foodName, ServingSizeParser.DEFAULT_SERVING);
    }

    /**
     * 1) 正規化 → 查無 NOT_FOUND
     * 2) 七個欄位都要有 → 否則 MISSING_DATA
     * 3) 份量 → 公克，格式錯 INVALID_SERVING_FORMAT
     * 4) macro × (grams / 100)
     * 5) GL = GI × 份量碳水 / 100（GI 本身不縮放）
     */
    public NutritionFeatures getFeatures(String foodName, String servingSpec) {
        FoodRecord r = foods.get(normalize(foodName));
        if (r == null) throw FoodLookupException.notFound(foodName);

        List<String> missing = r.missingFields();
        if (!missing.isEmpty()) throw FoodLookupException.missingData(r.canonicalName(), missing);

        double grams = ServingSizeParser.toGrams(servingSpec, r.servingSizeGrams());
        double scale = grams / 100.0;

        double carbs = r.carbohydrates() * scale;
        double gi = r.glycemicIndex();

        return new NutritionFeatures(
                gi,
                glycemicLoad(gi, carbs),
                carbs,
                r.fiber() * scale,
                r.protein() * scale,
                r.fat() * scale,
                r.processingLevel(),
                grams
        );
    }

    static double glycemicLoad(double glycemicIndex, double carbsPerServing) {
        return (glycemicIndex * carbsPerServing) / 100.0;
    }

    private static FoodRecord withName(FoodRecord r, String key) {
        return new FoodRecord(key, r.glycemicIndex(), r.carbohydrates(), r.fiber(), r.protein(),
                r.fat(), r.processingLevel(), r.servingSizeGrams());
    }

    private static String preview(Set<String> keys) {
        return keys.stream().limit(10).toList() + (keys.size() > 10 ? " ..." : "");
    }
}
