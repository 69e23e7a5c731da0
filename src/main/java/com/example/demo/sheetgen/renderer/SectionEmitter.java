package com.example.demo.sheetgen.renderer;

import com.example.demo.sheetgen.data.RecordAccessors;
import com.example.demo.sheetgen.exception.ReportGenerationException;
import com.example.demo.sheetgen.layout.CellAnchor;
import com.example.demo.sheetgen.layout.DiffFormulaGenerator;
import com.example.demo.sheetgen.layout.PlacementTable;
import com.example.demo.sheetgen.layout.ResolvedSection;
import com.example.demo.sheetgen.layout.StyleResolver;
import com.example.demo.sheetgen.model.ColumnConfig;
import com.example.demo.sheetgen.model.SectionConfig;
import com.example.demo.sheetgen.model.StyleTemplate;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellRangeAddress;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Writes the rows of a section into one sheet: title, hidden field-name row,
 * header and data rows, together with merges, row heights, column widths and
 * autofilters. Shared by the batch renderer and the streaming writer so both
 * produce identical cells for identical input.
 */
@Slf4j
public class SectionEmitter {
    private static final int MAX_COLUMN_WIDTH_CHARS = 255;
    private static final long MAX_EXACT_INTEGER = 1L << 53;

    private final Sheet sheet;
    private final CellStyleCache styles;
    private final StyleResolver styleResolver;
    private final Map<String, Function<Object, Object>> formatters;
    private final PlacementTable placements;
    private final boolean failOnComparisonError;
    private final IntConsumer hiddenRowSink;
    private final Set<String> warnedFormatters = new HashSet<>();

    /**
     * @param failOnComparisonError when false, unresolvable comparison cells get an error marker instead
     * @param hiddenRowSink receives the index of every row that must end up invisible
     */
    public SectionEmitter(Sheet sheet,
                          CellStyleCache styles,
                          StyleResolver styleResolver,
                          Map<String, Function<Object, Object>> formatters,
                          PlacementTable placements,
                          boolean failOnComparisonError,
                          IntConsumer hiddenRowSink) {
        this.sheet = sheet;
        this.styles = styles;
        this.styleResolver = styleResolver;
        this.formatters = formatters;
        this.placements = placements;
        this.failOnComparisonError = failOnComparisonError;
        this.hiddenRowSink = hiddenRowSink;
    }

    /**
     * Emits the rows that precede the data rows.
     *
     * @return index of the first data row
     */
    public int emitLeadingRows(ResolvedSection section, CellAnchor anchor) {
        int row = anchor.getRow();
        if (section.hasTitleRow()) {
            emitTitle(section, row, anchor.getCol());
            row++;
        }
        if (section.hasHiddenFieldRow()) {
            emitHiddenFieldRow(section, row, anchor.getCol());
            row++;
        }
        if (section.hasHeaderRow()) {
            emitHeader(section, row, anchor.getCol());
            row++;
        }
        applyColumnWidths(section, anchor.getCol());
        return row;
    }

    public void emitTitle(ResolvedSection section, int rowIndex, int col) {
        SectionConfig config = section.getConfig();
        Row row = row(rowIndex);
        StyleTemplate style = styleResolver.resolve(config.getTitleStyle(), styleResolver.titleDefault(),
                section.isTitleLocked());
        CellStyle cellStyle = styles.get(style);
        Cell cell = row.createCell(col);
        cell.setCellValue(config.getTitle());
        cell.setCellStyle(cellStyle);

        int span = section.titleSpan();
        if (span > 1) {
            for (int c = col + 1; c < col + span; c++) {
                row.createCell(c).setCellStyle(cellStyle);
            }
            sheet.addMergedRegion(new CellRangeAddress(rowIndex, rowIndex, col, col + span - 1));
        }
        if (config.getTitleHeight() > 0) {
            row.setHeightInPoints((float) config.getTitleHeight());
        }
        markHiddenIfNeeded(section, rowIndex);
    }

    public void emitHiddenFieldRow(ResolvedSection section, int rowIndex, int col) {
        Row row = row(rowIndex);
        CellStyle cellStyle = styles.get(styleResolver.hiddenFieldRowStyle());
        List<ColumnConfig> columns = section.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            Cell cell = row.createCell(col + i);
            String hiddenName = columns.get(i).getHiddenFieldName();
            if (hiddenName != null) {
                cell.setCellValue(hiddenName);
            }
            cell.setCellStyle(cellStyle);
        }
        hiddenRowSink.accept(rowIndex);
    }

    public void emitHeader(ResolvedSection section, int rowIndex, int col) {
        SectionConfig config = section.getConfig();
        Row row = row(rowIndex);
        List<ColumnConfig> columns = section.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            ColumnConfig column = columns.get(i);
            Cell cell = row.createCell(col + i);
            if (column.getHeader() != null) {
                cell.setCellValue(column.getHeader());
            }
            StyleTemplate style = styleResolver.resolve(config.getHeaderStyle(), styleResolver.headerDefault(),
                    section.isCellLocked(column));
            cell.setCellStyle(styles.get(style));
        }
        if (config.getHeaderHeight() > 0) {
            row.setHeightInPoints((float) config.getHeaderHeight());
        }
        markHiddenIfNeeded(section, rowIndex);
    }

    /**
     * Emits one data row. {@code item} may be null for sections that mirror the
     * row count of another section; such rows still carry styles and formulas.
     */
    public void emitDataRow(ResolvedSection section, int rowIndex, int col, Object item, int rowOffset) {
        SectionConfig config = section.getConfig();
        Row row = row(rowIndex);
        StyleTemplate dataDefault = config.isHidden() ? styleResolver.hiddenDefault() : null;
        List<ColumnConfig> columns = section.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            ColumnConfig column = columns.get(i);
            Cell cell = row.createCell(col + i);
            if (column.isComparison()) {
                writeComparison(cell, column, rowOffset);
            } else if (item != null) {
                writeValue(cell, format(column, RecordAccessors.valueOf(item, column.getFieldName())));
            }
            StyleTemplate style = styleResolver.resolve(config.getDataStyle(), dataDefault, section.isCellLocked(column));
            cell.setCellStyle(styles.get(style));
        }
        double height = section.dataRowHeight();
        if (height > 0) {
            row.setHeightInPoints((float) height);
        }
        markHiddenIfNeeded(section, rowIndex);
    }

    public void applyColumnWidths(ResolvedSection section, int col) {
        List<ColumnConfig> columns = section.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            double width = columns.get(i).getWidth();
            if (width > 0) {
                double clamped = Math.min(width, MAX_COLUMN_WIDTH_CHARS);
                sheet.setColumnWidth(col + i, (int) Math.round(clamped * 256));
            }
        }
    }

    /**
     * Adds an autofilter over the header row and the data rows when the section asks for one.
     *
     * @param dataEndRow first row after the last data row
     */
    public void applyAutoFilter(ResolvedSection section, CellAnchor anchor, int dataEndRow) {
        if (!section.getConfig().isHasFilter() || !section.hasHeaderRow() || section.getColumns().isEmpty()) {
            return;
        }
        int headerRow = anchor.getRow() + (section.hasTitleRow() ? 1 : 0) + (section.hasHiddenFieldRow() ? 1 : 0);
        int lastRow = Math.max(headerRow, dataEndRow - 1);
        int lastCol = anchor.getCol() + section.getColumns().size() - 1;
        sheet.setAutoFilter(new CellRangeAddress(headerRow, lastRow, anchor.getCol(), lastCol));
    }

    private void writeComparison(Cell cell, ColumnConfig column, int rowOffset) {
        try {
            cell.setCellFormula(DiffFormulaGenerator.diffFormula(column, rowOffset, placements));
        } catch (ReportGenerationException e) {
            if (failOnComparisonError) {
                throw e;
            }
            log.warn("Comparison column '{}' could not be resolved: {}", column.getFieldName(), e.getDescription());
            cell.setCellValue("Error: " + e.getDescription());
        }
    }

    private Object format(ColumnConfig column, Object value) {
        if (column.getFormatterFunction() != null) {
            return column.getFormatterFunction().apply(value);
        }
        String name = column.getFormatter();
        if (name != null && !name.isEmpty()) {
            Function<Object, Object> formatter = formatters.get(name);
            if (formatter != null) {
                return formatter.apply(value);
            }
            if (warnedFormatters.add(name)) {
                log.warn("Formatter '{}' is not registered; writing raw values for column '{}'", name, column.getFieldName());
            }
        }
        return value;
    }

    private void writeValue(Cell cell, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Number) {
            writeNumber(cell, (Number) value);
        } else if (value instanceof Boolean) {
            cell.setCellValue((Boolean) value);
        } else {
            cell.setCellValue(value.toString());
        }
    }

    /**
     * Integers a double cannot hold exactly are written as text.
     */
    private void writeNumber(Cell cell, Number number) {
        if ((number instanceof Long && (number.longValue() > MAX_EXACT_INTEGER || number.longValue() < -MAX_EXACT_INTEGER))
                || (number instanceof BigInteger && ((BigInteger) number).abs().compareTo(BigInteger.valueOf(MAX_EXACT_INTEGER)) > 0)) {
            cell.setCellValue(number.toString());
        } else {
            cell.setCellValue(number.doubleValue());
        }
    }

    private void markHiddenIfNeeded(ResolvedSection section, int rowIndex) {
        if (section.getConfig().isHidden()) {
            hiddenRowSink.accept(rowIndex);
        }
    }

    private Row row(int index) {
        Row row = sheet.getRow(index);
        return row != null ? row : sheet.createRow(index);
    }
}
