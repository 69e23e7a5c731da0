package com.example.demo.sheetgen.renderer;

import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;
import org.apache.poi.xssf.usermodel.XSSFSheet;

/**
 * Lock handling for sheets that contain locked cells.
 */
public final class SheetProtection {

    private SheetProtection() {
    }

    /**
     * Makes every cell without an explicit style editable. Cells written by the
     * emitters always carry their own lock flag, so only the unused area is affected.
     */
    public static void unlockUnstyledCells(Workbook workbook) {
        workbook.getCellStyleAt(0).setLocked(false);
    }

    /**
     * Protects the sheet without a password. Formatting rows and columns,
     * using autofilters and selecting cells stay allowed; everything else is prohibited.
     */
    public static void protect(Sheet sheet) {
        XSSFSheet xssfSheet = underlyingSheet(sheet);
        xssfSheet.enableLocking();
        xssfSheet.lockFormatCells(true);
        xssfSheet.lockFormatColumns(false);
        xssfSheet.lockFormatRows(false);
        xssfSheet.lockInsertColumns(true);
        xssfSheet.lockInsertRows(true);
        xssfSheet.lockInsertHyperlinks(true);
        xssfSheet.lockDeleteColumns(true);
        xssfSheet.lockDeleteRows(true);
        xssfSheet.lockSort(true);
        xssfSheet.lockAutoFilter(false);
        xssfSheet.lockPivotTables(true);
        xssfSheet.lockSelectLockedCells(false);
        xssfSheet.lockSelectUnlockedCells(false);
    }

    static XSSFSheet underlyingSheet(Sheet sheet) {
        if (sheet instanceof XSSFSheet) {
            return (XSSFSheet) sheet;
        }
        Workbook workbook = sheet.getWorkbook();
        if (workbook instanceof SXSSFWorkbook) {
            return ((SXSSFWorkbook) workbook).getXSSFWorkbook().getSheet(sheet.getSheetName());
        }
        throw new IllegalArgumentException("Unsupported sheet type " + sheet.getClass().getName());
    }
}
