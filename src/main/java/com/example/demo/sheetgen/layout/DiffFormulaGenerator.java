package com.example.demo.sheetgen.layout;

import com.example.demo.sheetgen.exception.ReferenceResolutionException;
import com.example.demo.sheetgen.model.ColumnConfig;
import com.example.demo.sheetgen.model.CompareConfig;

/**
 * Builds the equality-diff formula of comparison columns.
 * <p>
 * Example: {@code IF(B4<>D4,"Diff","")}
 */
public final class DiffFormulaGenerator {
    public static final String DIFF_MARKER = "Diff";

    private DiffFormulaGenerator() {
    }

    /**
     * @param rowOffset zero-based data row index within the comparison section
     */
    public static String diffFormula(ColumnConfig column, int rowOffset, PlacementTable placements) {
        CompareConfig with = column.getCompareWith();
        CompareConfig against = column.getCompareAgainst();
        if (with == null) {
            throw new IllegalArgumentException("Column '" + column.getFieldName() + "' is not a comparison column");
        }
        if (against == null) {
            throw new ReferenceResolutionException("MISSING_COMPARE_AGAINST",
                    "compare_against is required for comparison column '" + column.getFieldName() + "'");
        }
        String cellA = placements.resolveCellAddress(with.getSectionId(), with.getFieldName(), rowOffset);
        String cellB = placements.resolveCellAddress(against.getSectionId(), against.getFieldName(), rowOffset);
        return "IF(" + cellA + "<>" + cellB + ",\"" + DIFF_MARKER + "\",\"\")";
    }
}
