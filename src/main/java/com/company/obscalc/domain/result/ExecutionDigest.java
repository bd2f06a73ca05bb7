package com.company.obscalc.domain.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionDigest implements Serializable {
    private static final long serialVersionUID = 1L;

    private Duration fullSetupTime;
    private Duration reacquisitionSetupTime;
    private SequenceDigest acquisition;
    private SequenceDigest science;
}
