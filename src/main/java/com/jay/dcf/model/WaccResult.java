package com.jay.dcf.model;

public record WaccResult(double costOfEquity, double afterTaxCostOfDebt,
                         double debtWeight, double equityWeight, double wacc) {}
