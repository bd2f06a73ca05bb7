package com.company.obscalc.domain.result;

import com.company.obscalc.domain.enums.ExecutionState;
import com.company.obscalc.domain.enums.ObserveClass;
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
public class SequenceDigest implements Serializable {
    private static final long serialVersionUID = 1L;

    private ObserveClass observeClass;
    private Duration nonChargedTime;
    private Duration programTime;
    private int atomCount;
    private ExecutionState executionState;
}
