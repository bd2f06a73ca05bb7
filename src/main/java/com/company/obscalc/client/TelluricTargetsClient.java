package com.company.obscalc.client;

import com.company.obscalc.domain.TelluricQuery;
import com.company.obscalc.domain.result.TelluricResolutionResult;

import java.util.Optional;

/**
 * Searches the telluric standard catalog. Empty when no star matches.
 */
public interface TelluricTargetsClient {

    Optional<TelluricResolutionResult> search(TelluricQuery query);
}
