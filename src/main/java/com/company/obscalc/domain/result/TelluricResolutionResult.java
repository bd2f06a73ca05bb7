package com.company.obscalc.domain.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelluricResolutionResult implements Serializable {
    private static final long serialVersionUID = 1L;

    private String scienceObservationId;
    private String targetId;
    private String targetName;
}
