package com.jay.dcf.layer2_discounting;

import com.jay.dcf.exception.ValuationException;
import com.jay.dcf.model.WaccInputs;
import com.jay.dcf.model.WaccResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Weighted average cost of capital from CAPM and after-tax cost of debt.
 *
 *   Ke   = rf + β × MRP
 *   WACC = Ke × We + Kd × (1 − tax) × Wd
 *
 * Weights that do not sum to 1 are normalised.
 */
@Slf4j
@Component
public class WaccCalculator {

    public WaccResult calculate(WaccInputs in) {
        if (in == null) {
            throw new ValuationException("WACC inputs are required when no discount rate is given");
        }
        double wd = in.getDebtWeight();
        double we = in.getEquityWeight();
        if (wd < 0 || we < 0 || !(wd + we > 0)) {
            throw new ValuationException(String.format(
                "Capital weights must be non-negative with a positive sum (debt=%.4f, equity=%.4f)", wd, we));
        }
        double total = wd + we;
        wd /= total;
        we /= total;

        double costOfEquity = in.getRiskFreeRate() + in.getBeta() * in.getMarketRiskPremium();
        double afterTaxDebt = in.getCostOfDebt() * (1 - in.getTaxRate());
        double wacc = costOfEquity * we + afterTaxDebt * wd;

        log.debug("WACC: Ke={} Kd(after tax)={} We={} Wd={} → {}", costOfEquity, afterTaxDebt, we, wd, wacc);
        return new WaccResult(costOfEquity, afterTaxDebt, wd, we, wacc);
    }
}
