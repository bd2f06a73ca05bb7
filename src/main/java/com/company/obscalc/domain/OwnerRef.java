package com.company.obscalc.domain;

import com.company.obscalc.domain.enums.OwnerKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OwnerRef {
    private OwnerKind kind;
    private String id;

    public static OwnerRef program(String programId) {
        return new OwnerRef(OwnerKind.PROGRAM, programId);
    }

    public static OwnerRef callForProposals(String cfpId) {
        return new OwnerRef(OwnerKind.CALL_FOR_PROPOSALS, cfpId);
    }
}
