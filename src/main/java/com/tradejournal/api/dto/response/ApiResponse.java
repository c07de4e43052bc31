package com.tradejournal.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collection;
import lombok.Getter;

/**
 * Success envelope added by {@code ApiResponseAdvice}. List payloads (trades, fills, grouped stats)
 * also carry their size in {@code count}.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Integer count;
    private final Instant timestamp;

    private ApiResponse(T data, Integer count) {
        this.data = data;
        this.count = count;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        Integer count = data instanceof Collection<?> collection ? collection.size() : null;
        return new ApiResponse<>(data, count);
    }
}
