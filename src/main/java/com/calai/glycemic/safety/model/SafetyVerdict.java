package com.calai.glycemic.safety.model;

/**
 * label：兩軸取最嚴重者
 * explanation：固定兩句（GL 先、GI 後），不論哪一軸決定結果都會列出
 */
public record SafetyVerdict(
        SafetyLabel label,
        String explanation,
        SafetyLabel glycemicLoadCategory,
        SafetyLabel glycemicIndexCategory
) {}
