package com.residencepark.visitorparking.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

/**
 * DTO for changing a visitor's status. Accepts "active" or "left" in any case.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class StatusUpdateRequest {

    @NotBlank(message = "Status is required")
    private String status;
}
