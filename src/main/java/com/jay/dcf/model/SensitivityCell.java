package com.jay.dcf.model;

import com.jay.dcf.model.enums.CellStatus;

/**
 * One cell of a sensitivity grid. Invalid cells carry no value, only the reason.
 */
public record SensitivityCell(
    int row,
    int column,
    double discountRate,
    double terminalGrowthRate,
    CellStatus status,
    Double impliedPerShareValue,
    String reason
) {
    public static SensitivityCell valid(int row, int column, double discountRate,
                                        double terminalGrowthRate, double impliedPerShareValue) {
        return new SensitivityCell(row, column, discountRate, terminalGrowthRate,
            CellStatus.VALID, impliedPerShareValue, null);
    }

    public static SensitivityCell invalid(int row, int column, double discountRate,
                                          double terminalGrowthRate, String reason) {
        return new SensitivityCell(row, column, discountRate, terminalGrowthRate,
            CellStatus.INVALID_RATE_RELATIONSHIP, null, reason);
    }

    public boolean valid() {
        return status == CellStatus.VALID;
    }
}
