package com.company.obscalc.domain.result;

import com.company.obscalc.domain.enums.WorkflowState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservationWorkflow implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Reported when the workflow could not be computed.
     */
    public static final ObservationWorkflow UNDEFINED = new ObservationWorkflow(
            WorkflowState.UNDEFINED, List.of(WorkflowState.INACTIVE), List.of());

    private WorkflowState state;

    @Builder.Default
    private List<WorkflowState> validTransitions = new ArrayList<>();

    @Builder.Default
    private List<ObservationValidation> validationErrors = new ArrayList<>();
}
