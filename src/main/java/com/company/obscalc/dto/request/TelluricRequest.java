package com.company.obscalc.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelluricRequest {
    @NotBlank(message = "Calibration observation ID is required")
    private String calibrationObservationId;

    @NotBlank(message = "Science observation ID is required")
    private String scienceObservationId;
}
