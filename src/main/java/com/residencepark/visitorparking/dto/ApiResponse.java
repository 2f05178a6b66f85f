package com.residencepark.visitorparking.dto;

import lombok.*;

import java.time.LocalDateTime;

/**
 * Envelope for every JSON body returned by the visitor-parking API:
 * {success, message, data, timestamp}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApiResponse {

    private boolean success;
    private String message;
    private Object data;

    /** Server time the response was produced. */
    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    public static ApiResponse success(Object data, String message) {
        return ApiResponse.builder().success(true).message(message).data(data).build();
    }

    public static ApiResponse success(String message) {
        return success(null, message);
    }

    public static ApiResponse error(String message) {
        return ApiResponse.builder().success(false).message(message).build();
    }
}
