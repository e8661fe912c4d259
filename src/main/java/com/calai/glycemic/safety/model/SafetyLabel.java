package com.calai.glycemic.safety.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 嚴重度由低到高；宣告順序即優先序（UNSAFE > CAUTION > SAFE） */
public enum SafetyLabel {
    SAFE,
    CAUTION,
    UNSAFE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SafetyLabel mostSevere(SafetyLabel a, SafetyLabel b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
