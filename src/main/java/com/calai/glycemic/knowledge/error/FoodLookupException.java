package com.calai.glycemic.knowledge.error;

import java.util.List;

/**
 * 知識庫查詢錯誤；呼叫端用 {@link #kind()} 分流，不靠子類別。
 */
public class FoodLookupException extends RuntimeException {

    public enum Kind {
        /** CSV 打不開 / 讀不完：啟動失敗 */
        SOURCE_UNAVAILABLE,
        /** 正規化後查無此食物 */
        NOT_FOUND,
        /** 有這筆，但算 features 需要的欄位缺值 */
        MISSING_DATA,
        /** 份量字串不符語法或為負數 */
        INVALID_SERVING_FORMAT
    }

    private final Kind kind;
    private final String foodName;
    private final List<String> missingFields;

    private FoodLookupException(Kind kind, String message, String foodName,
                                List<String> missingFields, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.foodName = foodName;
        this.missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
    }

    public static FoodLookupException sourceUnavailable(String source, Throwable cause) {
        String why = (cause == null || cause.getMessage() == null) ? "" : ": " + cause.getMessage();
        return new FoodLookupException(Kind.SOURCE_UNAVAILABLE,
                "Nutrition source unavailable (" + source + ")" + why, null, null, cause);
    }

    public static FoodLookupException sourceUnavailable(String source, String reason) {
        return new FoodLookupException(Kind.SOURCE_UNAVAILABLE,
                "Nutrition source unavailable (" + source + "): " + reason, null, null, null);
    }

    public static FoodLookupException notFound(String foodName) {
        return new FoodLookupException(Kind.NOT_FOUND,
                "Food '" + foodName + "' not found in knowledge base", foodName, null, null);
    }

    public static FoodLookupException missingData(String foodName, List<String> missingFields) {
        return new FoodLookupException(Kind.MISSING_DATA,
                "Food '" + foodName + "' is missing required data: " + String.join(", ", missingFields),
                foodName, missingFields, null);
    }

    public static FoodLookupException invalidServing(String servingSpec, String reason) {
        return new FoodLookupException(Kind.INVALID_SERVING_FORMAT,
                "Invalid serving size '" + servingSpec + "': " + reason, null, null, null);
    }

    public Kind kind() { return kind; }
    public String foodName() { return foodName; }
    public List<String> missingFields() { return missingFields; }
}
