package com.example.demo.sheetgen.layout;

import com.example.demo.sheetgen.exception.ReferenceResolutionException;
import lombok.Value;
import org.apache.poi.ss.util.CellReference;

import java.util.Map;

/**
 * Resolved coordinates of one section, computed before any cell is written.
 * {@code startRow} is the first data row, not the anchor row.
 */
@Value
public class SectionPlacement {
    String sectionId;
    int anchorRow;
    int startRow;
    int startCol;
    Map<String, Integer> fieldOffsets;
    int dataLength;

    /**
     * @return relative A1 address of the given field at the given data row offset
     */
    public String cellAddress(String fieldName, int rowOffset) {
        Integer offset = fieldOffsets.get(fieldName);
        if (offset == null) {
            throw new ReferenceResolutionException("UNKNOWN_FIELD",
                    "Field '" + fieldName + "' not found in section '" + sectionId + "'");
        }
        return new CellReference(startRow + rowOffset, startCol + offset).formatAsString(false);
    }
}
