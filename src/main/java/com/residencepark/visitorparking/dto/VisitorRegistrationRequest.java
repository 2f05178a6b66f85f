package com.residencepark.visitorparking.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

/**
 * DTO for registering a new visitor.
 * Identity number and license plate are normalized (upper-cased) by VisitorService.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VisitorRegistrationRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 120, message = "Name must be at most 120 characters")
    private String name;

    @NotBlank(message = "Identity number is required")
    @Size(max = 32, message = "Identity number must be at most 32 characters")
    private String identityNumber;

    @NotBlank(message = "License plate is required")
    @Size(max = 16, message = "License plate must be at most 16 characters")
    private String licensePlate;

    @NotBlank(message = "Unit number is required")
    @Size(max = 16, message = "Unit number must be at most 16 characters")
    private String unitNumber;
}
