package com.yerin.stylizer.global.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DataResponse<T>(String message, T data) {

    public static <T> DataResponse<T> from(T data) {
        return new DataResponse<>(null, data);
    }

    public static <T> DataResponse<T> of(String message, T data) {
        return new DataResponse<>(message, data);
    }
}
