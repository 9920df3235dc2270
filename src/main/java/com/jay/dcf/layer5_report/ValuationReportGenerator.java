package com.jay.dcf.layer5_report;

import com.jay.dcf.config.ValuationConfig;
import com.jay.dcf.model.DiscountedFlow;
import com.jay.dcf.model.ProjectedPeriod;
import com.jay.dcf.model.SensitivityCell;
import com.jay.dcf.model.SensitivityGrid;
import com.jay.dcf.model.ValuationResult;
import com.jay.dcf.model.ValuationRun;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Layer 5: Valuation Report Generator.
 * Renders a valuation run and a sensitivity grid as plain text.
 * This is the only place where figures are rounded.
 */
@Component
@RequiredArgsConstructor
public class ValuationReportGenerator {

    private static final String DIVIDER =
        "━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━";

    private final ValuationConfig config;

    /**
     * Full DCF report: projected periods, present values, terminal value and the equity bridge.
     */
    public String generate(ValuationRun run) {
        ValuationResult r = run.result();
        String label = run.inputs().getLabel() != null ? run.inputs().getLabel() : "ad-hoc";

        StringBuilder sb = new StringBuilder();
        sb.append("DCF VALUATION REPORT  —  ").append(label).append("\n");
        sb.append(DIVIDER).append("\n");
        sb.append(line("BASE REVENUE      :  %s%n", money(run.inputs().getBaseRevenue())));
        sb.append(line("DISCOUNT RATE     :  %s%n", pct(r.getDiscountRate())));
        sb.append(line("TERMINAL GROWTH   :  %s%n", pct(r.getTerminalGrowthRate())));
        sb.append(DIVIDER).append("\n");
        sb.append(line("%-8s %14s %14s %14s%n", "PERIOD", "REVENUE", "FCF", "PV(FCF)"));
        for (int i = 0; i < run.projection().size(); i++) {
            ProjectedPeriod p = run.projection().get(i);
            DiscountedFlow d = run.discounting().flows().get(i);
            sb.append(line("%-8d %14s %14s %14s%n",
                p.period(), money(p.revenue()), money(p.freeCashFlow()), money(d.presentValue())));
        }
        sb.append(DIVIDER).append("\n");
        sb.append(line("TERMINAL VALUE    :  %s%n", money(run.discounting().terminalValue())));
        sb.append(line("PV TERMINAL VALUE :  %s%n", money(r.getDiscountedTerminalValue())));
        sb.append(line("SUM PV(FCF)       :  %s%n", money(r.getSumOfDiscountedFlows())));
        sb.append(line("ENTERPRISE VALUE  :  %s%n", money(r.getEnterpriseValue())));
        sb.append(line("NET DEBT          :  %s%s%n", money(r.getNetDebt()),
            r.getNetDebt() < 0 ? "  (net cash)" : ""));
        sb.append(line("EQUITY VALUE      :  %s%n", money(r.getEquityValue())));
        sb.append(line("SHARES OUTSTANDING:  %s%n", money(r.getSharesOutstanding())));
        sb.append(line("IMPLIED PER SHARE :  %s%n", money(r.getImpliedPerShareValue())));
        if (r.getUpsidePct() != null) {
            sb.append(line("CURRENT PRICE     :  %s%n", money(r.getCurrentPrice())));
            sb.append(line("UPSIDE / DOWNSIDE :  %s%%%n", money(r.getUpsidePct())));
        }
        sb.append(DIVIDER).append("\n");
        return sb.toString();
    }

    /**
     * Implied per-share matrix. Rows are discount rates, columns terminal growth rates;
     * invalid cells print as n/a.
     */
    public String generateGrid(SensitivityGrid grid) {
        StringBuilder sb = new StringBuilder();
        sb.append("SENSITIVITY — implied value per share (rows: discount rate, columns: terminal growth)\n");
        sb.append(line("%-10s", "r \\ g"));
        for (Double g : grid.terminalGrowthRates()) {
            sb.append(line(" %10s", pct(g)));
        }
        sb.append("\n");
        for (int i = 0; i < grid.rowCount(); i++) {
            sb.append(line("%-10s", pct(grid.discountRates().get(i))));
            for (int j = 0; j < grid.columnCount(); j++) {
                SensitivityCell c = grid.cell(i, j);
                sb.append(line(" %10s", c.valid() ? money(c.impliedPerShareValue()) : "n/a"));
            }
            sb.append("\n");
        }
        if (grid.invalidCellCount() > 0) {
            sb.append(line("%d cell(s) n/a: discount rate must exceed terminal growth%n", grid.invalidCellCount()));
        }
        return sb.toString();
    }

    private String money(double v) {
        return String.format(Locale.ROOT, "%,." + config.defaults().getDisplayDecimals() + "f", v);
    }

    private String pct(double rate) {
        return String.format(Locale.ROOT, "%.2f%%", rate * 100);
    }

    private static String line(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }
}
