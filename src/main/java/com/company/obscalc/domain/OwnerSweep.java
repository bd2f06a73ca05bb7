package com.company.obscalc.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A deferred invalidation of every observation under an owner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OwnerSweep {
    private OwnerRef owner;
    private Instant changeTime;
}
