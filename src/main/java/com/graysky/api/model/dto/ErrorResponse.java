package com.graysky.api.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private String detail;

    public static ErrorResponse of(String detail) {
        return new ErrorResponse(detail);
    }
}
