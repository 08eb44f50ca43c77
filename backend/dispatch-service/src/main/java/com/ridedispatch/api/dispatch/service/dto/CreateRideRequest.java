package com.ridedispatch.api.dispatch.service.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRideRequest {

    @NotBlank
    private String customerId;

    @NotNull
    @Valid
    private LocationDTO pickup;

    @Valid
    private LocationDTO dropoff;

    // Null means any vehicle / any tier
    private String vehicleType;

    private String serviceTier;
}
