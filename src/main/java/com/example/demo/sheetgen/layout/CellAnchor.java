package com.example.demo.sheetgen.layout;

import com.example.demo.sheetgen.exception.LayoutException;
import lombok.Value;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.util.CellReference;

import java.util.regex.Pattern;

/**
 * Zero-based top-left cell of a section.
 */
@Value
public class CellAnchor {
    private static final Pattern A1_REFERENCE = Pattern.compile("\\$?[A-Za-z]{1,3}\\$?[1-9][0-9]{0,6}");

    int row;
    int col;

    /**
     * Parses an A1-style reference such as "C5" or "$C$5".
     *
     * @throws LayoutException when the text is not a cell reference inside the sheet bounds
     */
    public static CellAnchor parse(String position) {
        String trimmed = position == null ? "" : position.trim();
        if (!A1_REFERENCE.matcher(trimmed).matches()) {
            throw new LayoutException("INVALID_POSITION", "Cannot parse position '" + position + "' as a cell reference");
        }
        CellReference reference = new CellReference(trimmed.toUpperCase());
        SpreadsheetVersion version = SpreadsheetVersion.EXCEL2007;
        if (reference.getRow() > version.getLastRowIndex() || reference.getCol() > version.getLastColumnIndex()) {
            throw new LayoutException("INVALID_POSITION", "Position '" + position + "' is outside the sheet");
        }
        return new CellAnchor(reference.getRow(), reference.getCol());
    }

    public String formatAsString() {
        return new CellReference(row, col).formatAsString(false);
    }
}
