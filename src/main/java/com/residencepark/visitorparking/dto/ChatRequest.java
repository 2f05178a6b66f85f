package com.residencepark.visitorparking.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    @NotNull(message = "Query is required")
    @Size(max = 1000, message = "Query must be at most 1000 characters")
    private String query;
}
