package com.company.obscalc.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * Search parameters for a telluric standard, derived from the science
 * observation the calibration serves.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelluricQuery {
    private String scienceObservationId;
    private String programId;
    private List<String> scienceTargetIds;
    private String observingMode;
    private Duration scienceDuration;
}
