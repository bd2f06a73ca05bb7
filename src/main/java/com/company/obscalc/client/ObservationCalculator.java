package com.company.obscalc.client;

import com.company.obscalc.domain.ObservationSnapshot;
import com.company.obscalc.domain.result.ObservationCalcResult;

/**
 * Computes the derived results of one observation: ITC estimates, execution
 * digest and workflow.
 * <p>
 * Throws {@link com.company.obscalc.exception.InvalidCalculationInputException}
 * when the inputs cannot produce a result, and
 * {@link com.company.obscalc.exception.CalculatorUnavailableException} when the
 * attempt may succeed later.
 */
public interface ObservationCalculator {

    ObservationCalcResult calculate(ObservationSnapshot snapshot);
}
