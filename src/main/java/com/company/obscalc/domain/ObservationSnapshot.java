package com.company.obscalc.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Read-only view of the upstream inputs a calculation depends on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservationSnapshot {
    private String observationId;
    private String programId;
    private String callForProposalsId;
    private String observingMode;
    private String workflowUserState;
    private List<TargetRef> targets;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TargetRef {
        private String targetId;
        private String name;
        private String existence;
    }
}
