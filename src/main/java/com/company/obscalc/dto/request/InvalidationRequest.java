package com.company.obscalc.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvalidationRequest {
    @NotBlank(message = "Observation ID is required")
    private String observationId;

    // Defaults to the time the request is received
    private Instant changeTime;
}
