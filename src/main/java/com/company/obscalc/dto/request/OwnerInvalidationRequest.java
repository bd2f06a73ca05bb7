package com.company.obscalc.dto.request;

import com.company.obscalc.domain.enums.OwnerKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OwnerInvalidationRequest {
    @NotNull(message = "Owner kind is required (PROGRAM or CALL_FOR_PROPOSALS)")
    private OwnerKind ownerKind;

    @NotBlank(message = "Owner ID is required")
    private String ownerId;

    private Instant changeTime;
}
