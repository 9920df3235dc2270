package com.jay.dcf.layer3_valuation;

import com.jay.dcf.exception.InvalidShareCountException;
import com.jay.dcf.model.DiscountResult;
import com.jay.dcf.model.DiscountedFlow;
import com.jay.dcf.model.ValuationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Layer 3: Valuation Aggregator.
 * Sums the discounted flows and terminal value into enterprise value, bridges to equity
 * through net debt (negative = net cash) and divides by the share count.
 */
@Slf4j
@Component
public class ValuationAggregator {

    public ValuationResult aggregate(DiscountResult discounting, double netDebt, double sharesOutstanding) {
        return aggregate(discounting, netDebt, sharesOutstanding, null);
    }

    public ValuationResult aggregate(DiscountResult discounting, double netDebt,
                                     double sharesOutstanding, Double currentPrice) {
        return aggregate(discounting.flows(), discounting.discountedTerminalValue(), netDebt,
            sharesOutstanding, currentPrice, discounting.discountRate(), discounting.terminalGrowthRate());
    }

    /**
     * @param currentPrice optional market price; when positive the result carries an upside percentage
     * @throws InvalidShareCountException if sharesOutstanding is not positive
     */
    public ValuationResult aggregate(List<DiscountedFlow> discountedFlows, double discountedTerminalValue,
                                     double netDebt, double sharesOutstanding, Double currentPrice,
                                     double discountRate, double terminalGrowthRate) {
        checkShares(sharesOutstanding);

        double sumPv = 0;
        for (DiscountedFlow f : discountedFlows) sumPv += f.presentValue();
        double enterpriseValue = sumPv + discountedTerminalValue;
        double equityValue = enterpriseValue - netDebt;
        double perShare = equityValue / sharesOutstanding;

        boolean hasPrice = currentPrice != null && currentPrice > 0;
        Double upside = hasPrice ? ValuationResult.upsidePct(perShare, currentPrice) : null;

        return ValuationResult.builder()
            .discountRate(discountRate)
            .terminalGrowthRate(terminalGrowthRate)
            .sumOfDiscountedFlows(sumPv)
            .discountedTerminalValue(discountedTerminalValue)
            .enterpriseValue(enterpriseValue)
            .netDebt(netDebt)
            .equityValue(equityValue)
            .sharesOutstanding(sharesOutstanding)
            .impliedPerShareValue(perShare)
            .currentPrice(hasPrice ? currentPrice : null)
            .upsidePct(upside)
            .build();
    }

    public void checkShares(double sharesOutstanding) {
        if (!(sharesOutstanding > 0)) {
            throw new InvalidShareCountException(sharesOutstanding);
        }
    }
}
