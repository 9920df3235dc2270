package com.jay.dcf.model;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Implied per-share values over a (discount rate × terminal growth) grid.
 * Rows follow the discount-rate axis, columns the terminal-growth axis, both in the order supplied.
 * Cells are fixed once the sweep that produced the grid completes.
 */
public record SensitivityGrid(
    List<Double> discountRates,
    List<Double> terminalGrowthRates,
    List<List<SensitivityCell>> cells
) {
    public SensitivityGrid {
        discountRates = List.copyOf(discountRates);
        terminalGrowthRates = List.copyOf(terminalGrowthRates);
        if (cells.size() != discountRates.size()) {
            throw new IllegalArgumentException(String.format(
                "Grid has %d rows but %d discount rates", cells.size(), discountRates.size()));
        }
        List<List<SensitivityCell>> copy = new ArrayList<>(cells.size());
        for (List<SensitivityCell> row : cells) {
            if (row.size() != terminalGrowthRates.size()) {
                throw new IllegalArgumentException(String.format(
                    "Grid row has %d cells but %d terminal growth rates", row.size(), terminalGrowthRates.size()));
            }
            copy.add(List.copyOf(row));
        }
        cells = List.copyOf(copy);
    }

    public int rowCount()    { return discountRates.size(); }
    public int columnCount() { return terminalGrowthRates.size(); }
    public int cellCount()   { return rowCount() * columnCount(); }

    public SensitivityCell cell(int row, int column) {
        return cells.get(row).get(column);
    }

    /** Implied per-share value at (row, column), empty for an invalid cell. */
    public OptionalDouble valueAt(int row, int column) {
        SensitivityCell c = cell(row, column);
        return c.valid() ? OptionalDouble.of(c.impliedPerShareValue()) : OptionalDouble.empty();
    }

    public long validCellCount() {
        return cells.stream().flatMap(List::stream).filter(SensitivityCell::valid).count();
    }

    public long invalidCellCount() {
        return cellCount() - validCellCount();
    }
}
