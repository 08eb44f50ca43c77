package com.ridedispatch.api.dispatch.service.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of go-online: the driver's position and what they drive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverStatusRequest {

    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double latitude;

    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double longitude;

    private String vehicleType;

    private String serviceTier;

    @DecimalMin("0.0")
    @DecimalMax("5.0")
    private Double rating;
}
