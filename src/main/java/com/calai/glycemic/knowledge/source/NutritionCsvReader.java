package com.calai.glycemic.knowledge.source;

import com.calai.glycemic.knowledge.error.FoodLookupException;
import com.calai.glycemic.knowledge.model.FoodRecord;
import com.calai.glycemic.knowledge.nlp.FoodNameNorm;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * nutrition_data.csv（含 header）：
 * name, glycemic_index, carbohydrates, fiber, protein, fat, processing_level, serving_size_grams
 * <p>
 * - 數值空格 → null（不是 0）
 * - 數值格式錯 / 負數 / NaN → null（只記 debug，不拒收整列）
 * - serving_size_grams 必須 > 0，否則視為缺值
 * - name 正規化後為空 → 略過該列
 */
@Slf4j
public final class NutritionCsvReader {
    private NutritionCsvReader() {}

    public static final String COL_NAME = "name";
    public static final String COL_GI = "glycemic_index";
    public static final String COL_CARBS = "carbohydrates";
    public static final String COL_FIBER = "fiber";
    public static final String COL_PROTEIN = "protein";
    public static final String COL_FAT = "fat";
    public static final String COL_PROCESSING = "processing_level";
    public static final String COL_SERVING = "serving_size_grams";

    // 多出來的欄位直接忽略，不讓一列格式歪掉就整份載入失敗
    private static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .build();
    private static final CsvSchema SCHEMA = CsvSchema.emptySchema().withHeader();

    public static List<FoodRecord> read(Resource source) {
        String desc = source == null ? "null" : source.getDescription();
        if (source == null || !source.exists()) {
            throw FoodLookupException.sourceUnavailable(desc, "resource does not exist");
        }

        List<FoodRecord> out = new ArrayList<>();
        int line = 1; // header
        int skipped = 0;
        try (Reader reader = new InputStreamReader(source.getInputStream(), StandardCharsets.UTF_8);
             MappingIterator<Map<String, String>> rows =
                     MAPPER.readerForMapOf(String.class).with(SCHEMA).readValues(reader)) {
            // hasNextValue 會先把 header 讀進 schema；只有 header 的檔也要檢查欄位
            rows.hasNextValue();
            CsvSchema header = (CsvSchema) rows.getParserSchema();
            if (header == null || header.column(COL_NAME) == null) {
                throw FoodLookupException.sourceUnavailable(desc, "missing '" + COL_NAME + "' column");
            }
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                line++;
                FoodRecord r = toRecord(row, line);
                if (r == null) { skipped++; continue; }
                out.add(r);
            }
        } catch (FoodLookupException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw FoodLookupException.sourceUnavailable(desc, e);
        }

        if (skipped > 0) {
            log.warn("[KnowledgeBase] skipped {} row(s) with blank name in {}", skipped, desc);
        }
        log.debug("[KnowledgeBase] parsed {} row(s) from {}", out.size(), desc);
        return out;
    }

    static FoodRecord toRecord(Map<String, String> row, int line) {
        String key = FoodNameNorm.normalize(row.get(COL_NAME));
        if (key.isEmpty()) return null;

        Double servingGrams = number(row, COL_SERVING, line);
        if (servingGrams != null && servingGrams <= 0.0) {
            log.debug("[KnowledgeBase] line {}: non-positive {}={}, treated as missing", line, COL_SERVING, servingGrams);
            servingGrams = null;
        }

        return new FoodRecord(
                key,
                number(row, COL_GI, line),
                number(row, COL_CARBS, line),
                number(row, COL_FIBER, line),
                number(row, COL_PROTEIN, line),
                number(row, COL_FAT, line),
                text(row.get(COL_PROCESSING)),
                servingGrams
        );
    }

    private static Double number(Map<String, String> row, String column, int line) {
        String raw = row.get(column);
        if (raw == null) return null;
        String t = raw.strip();
        if (t.isEmpty()) return null;
        try {
            double v = Double.parseDouble(t);
            if (!Double.isFinite(v) || v < 0.0) {
                log.debug("[KnowledgeBase] line {}: {}='{}' out of range, treated as missing", line, column, raw);
                return null;
            }
            return v;
        } catch (NumberFormatException e) {
            log.debug("[KnowledgeBase] line {}: {}='{}' is not a number, treated as missing", line, column, raw);
            return null;
        }
    }

    /** processing_level 原樣保存，只有空值視為缺 */
    private static String text(String raw) {
        if (raw == null || raw.isBlank()) return null;
        return raw;
    }
}
