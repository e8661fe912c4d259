package com.calai.glycemic.common.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ApiErrorResponse(
        String errorCode,
        String message,
        String requestId,
        String foodName,
        List<String> missingFields
) {
    public ApiErrorResponse(String errorCode, String message, String requestId) {
        this(errorCode, message, requestId, null, null);
    }
}
