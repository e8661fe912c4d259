package com.calai.glycemic.food.web;

import com.calai.glycemic.common.web.ApiErrorResponse;
import com.calai.glycemic.common.web.RequestIdFilter;
import com.calai.glycemic.food.controller.FoodController;
import com.calai.glycemic.knowledge.error.FoodLookupException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice(assignableTypes = FoodController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class FoodExceptionAdvice {

    @ExceptionHandler(FoodLookupException.class)
    public ResponseEntity<ApiErrorResponse> handleLookup(FoodLookupException e, HttpServletRequest req) {
        HttpStatus status = switch (e.kind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case MISSING_DATA -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_SERVING_FORMAT -> HttpStatus.BAD_REQUEST;
            // 正常情況啟動就失敗了，不會走到這裡
            case SOURCE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        log.debug("[FoodApi] {} -> {} {}", req.getRequestURI(), status.value(), e.getMessage());
        return ResponseEntity.status(status).body(new ApiErrorResponse(
                e.kind().name(),
                e.getMessage(),
                rid(req),
                e.foodName(),
                e.missingFields()
        ));
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception e, HttpServletRequest req) {
        String msg = e.getMessage();
        String code = (e instanceof IllegalArgumentException && msg != null && msg.matches("[A-Z_]+"))
                ? msg : "BAD_REQUEST";
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiErrorResponse(code, msg == null ? code : msg, rid(req)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("[FoodApi] unexpected error on {}", req.getRequestURI(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiErrorResponse("INTERNAL_ERROR", "INTERNAL_ERROR", rid(req)));
    }

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.getOrCreate(req);
    }
}
