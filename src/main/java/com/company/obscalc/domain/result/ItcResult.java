package com.company.obscalc.domain.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItcResult implements Serializable {
    private static final long serialVersionUID = 1L;

    private String targetId;
    private Duration exposureTime;
    private Integer exposureCount;

    // Signal to noise at the given wavelength, absent when the ITC reports none
    private BigDecimal wavelengthNm;
    private BigDecimal singleSignalToNoise;
    private BigDecimal totalSignalToNoise;
}
