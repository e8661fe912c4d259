package com.calai.glycemic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 啟動順序：
 * 1) 讀取 nutrition CSV → NutritionKnowledgeBase（一次性、唯讀）
 * 2) 預先計算食物名稱 embedding → FoodNameMatcher（失敗則退回子字串比對）
 * 兩者都在 context 啟動時完成，之後的查詢不再有 I/O
 */
@SpringBootApplication
public class GlycemicGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(GlycemicGuardApplication.class, args);
    }
}
