package com.company.obscalc.domain.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Payload produced by the remote calculator. ITC results are absent when the
 * observation has no usable target.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservationCalcResult implements Serializable {
    private static final long serialVersionUID = 1L;

    private ItcResult imaging;
    private ItcResult spectroscopy;
    private ExecutionDigest digest;
    private ObservationWorkflow workflow;
}
